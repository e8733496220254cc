package work.lcod.serverdata.model;

public enum PvpMatchType {
    FATE,
    VALHALLA,
    CUSTOM
}
