package work.lcod.serverdata.model;

import java.util.List;

/**
 * Gameplay mode layered onto a zone instance. {@code pvp} is only set on PvP capable variants.
 */
public record ServerZoneInstanceVariant(
    int id,
    InstanceType instanceType,
    int subId,
    List<Integer> timePoints,
    PvpSettings pvp
) {
    public ServerZoneInstanceVariant {
        instanceType = instanceType == null ? InstanceType.NORMAL : instanceType;
        timePoints = ModelCollections.list(timePoints);
    }
}
