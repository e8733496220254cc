package work.lcod.serverdata.model;

/**
 * Entities an action is applied to, relative to the entity that fired it.
 */
public enum SourceContext {
    SOURCE,
    ALL,
    PARTY,
    ENEMIES,
    ZONE
}
