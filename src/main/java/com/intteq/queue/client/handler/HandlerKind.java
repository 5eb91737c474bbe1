package com.intteq.queue.client.handler;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The four handler flavours: synchronous or asynchronous, cyclic-unsafe or non-cyclic.
 */
@Getter
@RequiredArgsConstructor
public enum HandlerKind {

    SYNC(MessageHandler.class, false, false),
    ASYNC(AsyncMessageHandler.class, true, false),
    NON_CYCLIC(NonCyclicMessageHandler.class, false, true),
    ASYNC_NON_CYCLIC(AsyncNonCyclicMessageHandler.class, true, true);

    private final Class<?> contract;
    private final boolean async;
    private final boolean nonCyclic;

    /**
     * Finds the single handler contract implemented by {@code type}.
     *
     * @throws IllegalArgumentException if {@code type} implements none or several of them
     */
    public static HandlerKind of(Class<?> type) {
        HandlerKind found = null;
        for (HandlerKind kind : values()) {
            if (kind.contract.isAssignableFrom(type)) {
                if (found != null) {
                    throw new IllegalArgumentException(type.getName()
                            + " implements more than one handler interface: "
                            + found.contract.getSimpleName() + ", " + kind.contract.getSimpleName());
                }
                found = kind;
            }
        }
        if (found == null) {
            throw new IllegalArgumentException(type.getName() + " does not implement a handler interface");
        }
        return found;
    }
}
