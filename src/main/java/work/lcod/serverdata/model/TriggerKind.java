package work.lcod.serverdata.model;

public enum TriggerKind {
    ON_DEATH,
    ON_DIASPORA_BASE_CAPTURE,
    ON_DIASPORA_BASE_RESET,
    ON_FLAG_SET,
    ON_LOGIN,
    ON_PVP_BASE_CAPTURE,
    ON_PVP_COMPLETE,
    ON_PVP_START,
    ON_REVIVAL,
    ON_SETUP,
    ON_TIME,
    ON_SYSTEMTIME,
    ON_MOONPHASE,
    ON_ZONE_IN,
    ON_ZONE_OUT
}
