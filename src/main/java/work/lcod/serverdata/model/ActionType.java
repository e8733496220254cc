package work.lcod.serverdata.model;

/**
 * Closed set of action kinds an action list may contain.
 */
public enum ActionType {
    ADD_REMOVE_ITEMS(Requirement.PLAYER),
    ADD_REMOVE_STATUS(Requirement.NONE),
    CREATE_LOOT(Requirement.NONE),
    DELAY(Requirement.NESTED),
    DISPLAY_MESSAGE(Requirement.PLAYER),
    GRANT_SKILLS(Requirement.PLAYER),
    GRANT_XP(Requirement.PLAYER),
    PLAY_BGM(Requirement.PLAYER),
    PLAY_SOUND_EFFECT(Requirement.PLAYER),
    RUN_SCRIPT(Requirement.NONE),
    SET_HOMEPOINT(Requirement.PLAYER),
    SET_NPC_STATE(Requirement.NONE),
    SPAWN(Requirement.NESTED),
    SPECIAL_DIRECTION(Requirement.PLAYER),
    STAGE_EFFECT(Requirement.PLAYER),
    START_EVENT(Requirement.NONE),
    UPDATE_COMP(Requirement.PLAYER),
    UPDATE_FLAG(Requirement.PLAYER),
    UPDATE_LNC(Requirement.PLAYER),
    UPDATE_POINTS(Requirement.NONE),
    UPDATE_QUEST(Requirement.PLAYER),
    UPDATE_ZONE_FLAGS(Requirement.NONE),
    ZONE_CHANGE(Requirement.PLAYER),
    ZONE_INSTANCE(Requirement.PLAYER);

    /** What an action kind needs from the context it runs in. */
    public enum Requirement {
        /** Must run with a player target. */
        PLAYER,
        /** Embeds a nested action list validated on its own. */
        NESTED,
        NONE
    }

    private final Requirement requirement;

    ActionType(Requirement requirement) {
        this.requirement = requirement;
    }

    public Requirement requirement() {
        return requirement;
    }

    public boolean requiresPlayer() {
        return requirement == Requirement.PLAYER;
    }
}
