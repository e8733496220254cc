package work.lcod.serverdata.model;

import java.util.List;

/**
 * Shared AI behaviour referenced by enemy spawns; ids are 16 bit.
 */
public record AILogicGroup(int id, String script, List<Integer> skillIds) {
    public AILogicGroup {
        if (id < 0 || id > 0xFFFF) {
            throw new IllegalArgumentException("AI logic group id out of range: " + id);
        }
        skillIds = ModelCollections.list(skillIds);
    }
}
