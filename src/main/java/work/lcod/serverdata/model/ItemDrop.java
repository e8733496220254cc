package work.lcod.serverdata.model;

public record ItemDrop(int itemType, int minStack, int maxStack, float rate) {}
