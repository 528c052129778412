package pixinsight.ext.pipeline.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Mapping of branch id to the engine handle of that branch's working image.
 *
 * <p>At most one handle per branch. A branch that is absent has either not been
 * created yet or was merged away. All handle lookups of step handlers go through
 * this registry, so renames and collision avoidance are enforced in one place.</p>
 *
 * <p>Iteration order is registration order, which keeps checkpoint manifests and
 * logs stable between runs.</p>
 */
public class LiveImageRegistry {
    private static final Logger logger = LoggerFactory.getLogger(LiveImageRegistry.class);

    private final Map<String, String> handles = new LinkedHashMap<>();

    public LiveImageRegistry() {
    }

    public LiveImageRegistry(Map<String, String> initial) {
        handles.putAll(initial);
    }

    /**
     * Registers a branch that has no handle yet.
     *
     * @throws IllegalStateException if the branch is already live or the handle is used by another branch
     */
    public void register(String branchId, String handle) {
        if (handles.containsKey(branchId)) {
            throw new IllegalStateException("Branch '" + branchId + "' already has handle " + handles.get(branchId));
        }
        requireUnusedHandle(branchId, handle);
        handles.put(branchId, handle);
        logger.debug("Registered branch '{}' -> {}", branchId, handle);
    }

    /**
     * Points a live branch at a new handle, e.g. after a process replaced the image.
     *
     * @return the previous handle
     */
    public String replace(String branchId, String handle) {
        String previous = handles.get(branchId);
        if (previous == null) {
            throw new IllegalStateException("Branch '" + branchId + "' is not live");
        }
        if (!previous.equals(handle)) {
            requireUnusedHandle(branchId, handle);
            handles.put(branchId, handle);
            logger.debug("Branch '{}' moved from {} to {}", branchId, previous, handle);
        }
        return previous;
    }

    private void requireUnusedHandle(String branchId, String handle) {
        for (Map.Entry<String, String> entry : handles.entrySet()) {
            if (entry.getValue().equals(handle) && !entry.getKey().equals(branchId)) {
                throw new IllegalStateException("Handle " + handle + " already belongs to branch '"
                        + entry.getKey() + "'");
            }
        }
    }

    /**
     * Removes a branch.
     *
     * @return the handle the branch had, if it was live
     */
    public Optional<String> remove(String branchId) {
        String handle = handles.remove(branchId);
        if (handle != null) {
            logger.debug("Retired branch '{}' ({})", branchId, handle);
        }
        return Optional.ofNullable(handle);
    }

    public Optional<String> handleOf(String branchId) {
        return Optional.ofNullable(handles.get(branchId));
    }

    /**
     * @throws IllegalStateException if the branch is not live
     */
    public String requireHandle(String branchId) {
        String handle = handles.get(branchId);
        if (handle == null) {
            throw new IllegalStateException("Branch '" + branchId + "' has no live image");
        }
        return handle;
    }

    public boolean isLive(String branchId) {
        return handles.containsKey(branchId);
    }

    public boolean isEmpty() {
        return handles.isEmpty();
    }

    public int size() {
        return handles.size();
    }

    public Set<String> branches() {
        return Collections.unmodifiableSet(handles.keySet());
    }

    public Collection<String> handles() {
        return Collections.unmodifiableCollection(handles.values());
    }

    /** Copy of the current mapping. */
    public Map<String, String> snapshot() {
        return new LinkedHashMap<>(handles);
    }

    public void clear() {
        handles.clear();
    }

    /**
     * Replaces the whole mapping, used when a checkpoint is restored.
     */
    public void resetTo(Map<String, String> mapping) {
        handles.clear();
        handles.putAll(mapping);
    }

    /**
     * Derives a handle id that neither the registry nor the engine currently uses.
     * Engine ids must be valid identifiers, so anything else is replaced by '_'.
     *
     * @param base      preferred id
     * @param engineIds ids currently open in the engine
     */
    public String uniqueHandle(String base, Collection<String> engineIds) {
        String sanitized = base.replaceAll("[^A-Za-z0-9_]", "_");
        if (sanitized.isEmpty() || Character.isDigit(sanitized.charAt(0))) {
            sanitized = "img_" + sanitized;
        }
        Set<String> taken = new HashSet<>(engineIds);
        taken.addAll(handles.values());
        if (!taken.contains(sanitized)) {
            return sanitized;
        }
        int n = 1;
        while (taken.contains(sanitized + "_" + n)) {
            n++;
        }
        return sanitized + "_" + n;
    }

    @Override
    public String toString() {
        return handles.toString();
    }
}
