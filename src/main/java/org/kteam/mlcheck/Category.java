package org.kteam.mlcheck;

import java.util.Set;

/**
 * The role a message plays on the mailing list.  A message holds exactly one category at a
 * time; filters test membership in a group of categories with {@link #isAnyOf(Set)}.
 */
public enum Category {
    /** Noise on the list: discussion, questions, replies without a review verdict. */
    NOT_PATCH,
    /** Introductory message of a series, recognized by its template sections. */
    PATCH_COVER_LETTER,
    /** A patch in a series, or a single patch. */
    PATCH_N,
    PATCH_ACK,
    PATCH_NAK,
    /** Followup stating the patch was applied. */
    PATCH_APPLIED;

    /**
     * Returns true if this category is one of the given categories.
     *
     * @param categories Categories to test against
     * @return True if this category is a member of the set
     */
    public boolean isAnyOf(Set<Category> categories) {
        return categories.contains(this);
    }
}
