package work.lcod.serverdata.runtime;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the snapshot served to readers. A reload builds a complete new snapshot first and only
 * then replaces the current one; a failed reload leaves the current snapshot in place.
 */
public final class ServerDataHolder {
    private static final Logger LOGGER = LoggerFactory.getLogger(ServerDataHolder.class);

    private final AtomicReference<ServerDataSnapshot> current;

    public ServerDataHolder(ServerDataSnapshot initial) {
        this.current = new AtomicReference<>(Objects.requireNonNull(initial, "initial"));
    }

    public ServerDataSnapshot current() {
        return current.get();
    }

    /**
     * @return the snapshot that was replaced
     * @throws ServerDataException when the new load fails
     */
    public ServerDataSnapshot reload(Supplier<ServerDataSnapshot> loader) {
        var replacement = Objects.requireNonNull(loader.get(), "snapshot");
        var previous = current.getAndSet(replacement);
        LOGGER.info("Server data reloaded: {} zones, {} scripts", replacement.definitions().size(Category.ZONE),
            replacement.scripts().scripts().size() + replacement.scripts().aiScripts().size());
        return previous;
    }
}
