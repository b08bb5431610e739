package com.questrail.dtchat.message;

import java.util.Comparator;
import java.util.Objects;

/**
 * Selects the comparator used to present a message list.
 */
public sealed interface SortStrategy
        permits SortStrategy.Standard, SortStrategy.Relative
{
    Comparator<ChatMessage> comparator();

    static SortStrategy standard() {
        return Standard.INSTANCE;
    }

    static SortStrategy relativeTo(String viewerUuid) {
        return new Relative(viewerUuid);
    }

    /** Global send-time order. */
    enum Standard implements SortStrategy
    {
        INSTANCE;

        @Override
        public Comparator<ChatMessage> comparator() {
            return MessageOrdering.standard();
        }
    }

    /** Order as experienced by {@code viewerUuid}. */
    record Relative(String viewerUuid) implements SortStrategy
    {
        public Relative {
            Objects.requireNonNull(viewerUuid, "viewerUuid");
        }

        @Override
        public Comparator<ChatMessage> comparator() {
            return MessageOrdering.relativeTo(viewerUuid);
        }
    }
}
