package work.lcod.serverdata.model;

import java.util.List;

/**
 * NPC or object placed either on a spot ({@code spotId != 0}) or at explicit coordinates.
 * An entity with id 0 only exists inside partials, where it marks a removal.
 */
public interface PositionedEntity {
    int id();

    int spotId();

    float x();

    float y();

    List<Action> actions();
}
