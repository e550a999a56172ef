package com.yourapp.tracker.habit_tracker.cli;

import java.util.Objects;

/**
 * What the {@link ScreenController} should do after a screen returns.
 */
public final class Navigation {
    public enum Kind {
        STAY,       // show the same screen again
        PUSH,
        POP,
        REPLACE,    // pop, then push
        EXIT
    }

    private static final Navigation STAY = new Navigation(Kind.STAY, null);
    private static final Navigation POP = new Navigation(Kind.POP, null);
    private static final Navigation EXIT = new Navigation(Kind.EXIT, null);

    private final Kind kind;
    private final Screen target;

    private Navigation(Kind kind, Screen target) {
        this.kind = kind;
        this.target = target;
    }

    public static Navigation stay() {
        return STAY;
    }

    public static Navigation push(Screen screen) {
        return new Navigation(Kind.PUSH, Objects.requireNonNull(screen, "screen"));
    }

    public static Navigation pop() {
        return POP;
    }

    public static Navigation replace(Screen screen) {
        return new Navigation(Kind.REPLACE, Objects.requireNonNull(screen, "screen"));
    }

    public static Navigation exit() {
        return EXIT;
    }

    public Kind getKind() {
        return kind;
    }

    public Screen getTarget() {
        return target;
    }

    @Override
    public String toString() {
        return target == null ? kind.name() : kind + "(" + target.getClass().getSimpleName() + ")";
    }
}
