package work.lcod.serverdata.model;

public enum EventType {
    NPC_MESSAGE,
    EX_NPC_MESSAGE,
    MULTITALK,
    PROMPT,
    PERFORM_ACTIONS,
    OPEN_MENU,
    PLAY_SCENE,
    DIRECTION,
    ITIME,
    FORK
}
