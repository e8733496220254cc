package work.lcod.serverdata.model;

public enum ZoneInstanceMode {
    CREATE,
    JOIN,
    CLAN_JOIN,
    TEAM_JOIN,
    TEAM_PVP,
    START_TIMER,
    STOP_TIMER,
    LEAVE
}
