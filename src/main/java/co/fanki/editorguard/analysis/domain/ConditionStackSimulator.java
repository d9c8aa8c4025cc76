package co.fanki.editorguard.analysis.domain;

import co.fanki.editorguard.shared.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;

/**
 * Replays conditional-compilation directives to find the conditions
 * active at a position.
 *
 * <p>Directives are consumed in source order up to, but excluding, the
 * first one at or after the target position:</p>
 * <ul>
 *   <li>{@code #if} pushes a frame with its condition.</li>
 *   <li>{@code #elif} replaces the innermost frame with its condition.</li>
 *   <li>{@code #else} replaces the innermost frame with the else-branch
 *       frame.</li>
 *   <li>{@code #endif} pops the innermost frame.</li>
 * </ul>
 *
 * <p>Unbalanced input never fails. A stray {@code #elif}, {@code #else}
 * or {@code #endif} with nothing open is ignored, and an {@code #if}
 * that is never closed stays on the stack through the end of the
 * file.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ConditionStackSimulator {

    private static final Logger LOG = LoggerFactory.getLogger(
            ConditionStackSimulator.class);

    private ConditionStackSimulator() {
    }

    /**
     * Builds the condition stack active at a position.
     *
     * @param events the directive events of one file, in source order
     * @param position the target offset
     * @return the stack of active conditions, outermost first
     */
    public static ConditionStack simulate(
            final Iterator<DirectiveEvent> events, final int position) {

        Preconditions.requireNonNull(events, "Directive events are required");
        Preconditions.requireNonNegative(position, "Position must be >= 0");

        final ConditionStack stack = new ConditionStack();

        while (events.hasNext()) {
            final DirectiveEvent event = events.next();

            // A directive only guards text that follows it.
            if (event.sourceOffset() >= position) {
                break;
            }

            final boolean applied = switch (event.kind()) {
                case IF -> {
                    stack.push(ConditionFrame.conditioned(
                            event.conditionText()));
                    yield true;
                }
                case ELIF -> stack.replaceTop(ConditionFrame.conditioned(
                        event.conditionText()));
                case ELSE -> stack.replaceTop(ConditionFrame.elseBranch());
                case ENDIF -> stack.pop();
            };

            if (!applied) {
                LOG.debug("Ignoring unmatched #{} at offset {}",
                        event.kind().keyword(), event.sourceOffset());
            }
        }

        return stack;
    }

}
