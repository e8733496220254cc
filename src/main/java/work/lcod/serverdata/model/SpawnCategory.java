package work.lcod.serverdata.model;

public enum SpawnCategory {
    NORMAL,
    ALLY,
    BOSS
}
