package com.whereq.helios.governor;

import com.whereq.helios.model.UsageWindow;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Result of a mutation applied to the current window: the replacement window, if any, and a value for the caller
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class WindowUpdate<T> {

    private final UsageWindow window;

    private final T value;

    public static <T> WindowUpdate<T> replace(UsageWindow window, T value) {
        return new WindowUpdate<>(window, value);
    }

    public static <T> WindowUpdate<T> unchanged(T value) {
        return new WindowUpdate<>(null, value);
    }

    public boolean isChanged() {
        return window != null;
    }
}
