package de.bsommerfeld.fdf.layout;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Thrown when anchor references form a cycle, for example frame A anchored to
 * B while B is anchored to A. Such a document has no layout.
 */
public class LayoutCycleException extends RuntimeException {

    private final List<String> cycle;

    /**
     * @param cycle frame names along the cycle, starting and ending with the same frame
     */
    public LayoutCycleException(List<String> cycle) {
        super("Anchor cycle: " + String.join(" -> ", cycle));
        this.cycle = ImmutableList.copyOf(cycle);
    }

    public List<String> getCycle() {
        return cycle;
    }
}
