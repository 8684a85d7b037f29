package org.kteam.mlcheck;

import java.util.Collections;
import java.util.List;

/**
 * Assigns a {@link Category} to a single message without looking at any other message.
 *
 * Emails are difficult to characterize.  There are rules, but not everyone follows them and
 * mistakes happen; implementations are best effort.
 */
public interface MessageClassifier {

    /**
     * Returns the category for this message.
     *
     * @param message Message to classify
     * @return Category, never null
     */
    Category getCategory(Message message);

    /**
     * Returns the kernels affected by this patch as a list of handles.  No classifier extracts
     * these yet, so callers must not rely on a non-empty result.
     *
     * @param message Message to inspect
     * @return Kernel handles, currently always empty
     */
    default List<String> getAffectedKernels(Message message) {
        return Collections.emptyList();
    }
}
