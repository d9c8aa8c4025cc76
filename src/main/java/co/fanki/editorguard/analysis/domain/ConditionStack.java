package co.fanki.editorguard.analysis.domain;

import co.fanki.editorguard.shared.Preconditions;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * The conditional nesting levels enclosing a position.
 *
 * <p>Only supports push, replace-top and pop. Iteration goes from the
 * outermost level to the innermost one. Not thread-safe: each check
 * builds its own stack.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ConditionStack implements Iterable<ConditionFrame> {

    /** Innermost frame at the tail. */
    private final Deque<ConditionFrame> frames = new ArrayDeque<>();

    /**
     * Opens a new nesting level.
     *
     * @param frame the frame for the level's first branch
     */
    public void push(final ConditionFrame frame) {
        frames.addLast(Preconditions.requireNonNull(frame, "Frame is required"));
    }

    /**
     * Switches the innermost level to another branch.
     *
     * <p>Does nothing when the stack is empty.</p>
     *
     * @param frame the frame for the new branch
     * @return true if a level was open and got replaced
     */
    public boolean replaceTop(final ConditionFrame frame) {
        Preconditions.requireNonNull(frame, "Frame is required");
        if (frames.isEmpty()) {
            return false;
        }
        frames.removeLast();
        frames.addLast(frame);
        return true;
    }

    /**
     * Closes the innermost level.
     *
     * <p>Does nothing when the stack is empty.</p>
     *
     * @return true if a level was open and got closed
     */
    public boolean pop() {
        return frames.pollLast() != null;
    }

    /**
     * Returns the number of open levels.
     *
     * @return the depth
     */
    public int depth() {
        return frames.size();
    }

    /**
     * Checks whether no level is open.
     *
     * @return true if empty
     */
    public boolean isEmpty() {
        return frames.isEmpty();
    }

    /**
     * Returns a snapshot of the frames, outermost first.
     *
     * @return the frames
     */
    public List<ConditionFrame> frames() {
        return List.copyOf(frames);
    }

    @Override
    public Iterator<ConditionFrame> iterator() {
        return frames().iterator();
    }

    @Override
    public String toString() {
        return "ConditionStack" + frames;
    }

}
