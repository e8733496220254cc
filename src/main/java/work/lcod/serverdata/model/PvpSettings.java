package work.lcod.serverdata.model;

/**
 * PvP specific part of an instance variant.
 *
 * @param defaultInstanceId instance used when a match does not name one, 0 for none
 */
public record PvpSettings(PvpMatchType matchType, boolean specialMode, int defaultInstanceId) {
    public PvpSettings {
        matchType = matchType == null ? PvpMatchType.FATE : matchType;
    }

    public boolean isStandard() {
        return !specialMode && matchType != PvpMatchType.CUSTOM;
    }
}
