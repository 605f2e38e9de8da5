package de.bsommerfeld.fdf.layout;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only lookups over the complete, flattened frame set of one transform.
 */
final class FrameIndex {

    private final ImmutableMap<String, FrameDraft> byId;
    private final ImmutableListMultimap<String, FrameDraft> byName;

    FrameIndex(List<FrameDraft> drafts) {
        ImmutableMap.Builder<String, FrameDraft> ids = ImmutableMap.builder();
        ImmutableListMultimap.Builder<String, FrameDraft> names = ImmutableListMultimap.builder();
        for (FrameDraft draft : drafts) {
            ids.put(draft.id, draft);
            names.put(draft.name, draft);
        }
        this.byId = ids.buildOrThrow();
        this.byName = names.build();
    }

    Optional<FrameDraft> byId(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    /**
     * Resolves an anchor target name as seen from {@code referencer}. When
     * several frames share the name, the one with the referencer's parent wins,
     * otherwise the first in document order.
     */
    Optional<FrameDraft> resolveName(String name, FrameDraft referencer) {
        ImmutableList<FrameDraft> candidates = byName.get(name);
        if (candidates.isEmpty())
            return Optional.empty();
        if (candidates.size() > 1) {
            for (FrameDraft candidate : candidates) {
                if (Objects.equals(candidate.parentId, referencer.parentId))
                    return Optional.of(candidate);
            }
        }
        return Optional.of(candidates.get(0));
    }
}
