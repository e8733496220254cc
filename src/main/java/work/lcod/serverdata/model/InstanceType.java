package work.lcod.serverdata.model;

public enum InstanceType {
    NORMAL,
    TIME_TRIAL,
    PVP,
    DEMON_ONLY,
    DIASPORA,
    MISSION,
    PENTALPHA
}
