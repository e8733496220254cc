package work.lcod.serverdata.model;

/**
 * Registry key of a zone definition; the same zone id may exist once per dynamic map id.
 */
public record ZoneKey(int zoneId, int dynamicMapId) {
    @Override
    public String toString() {
        return zoneId != dynamicMapId ? zoneId + " (" + dynamicMapId + ")" : String.valueOf(zoneId);
    }
}
