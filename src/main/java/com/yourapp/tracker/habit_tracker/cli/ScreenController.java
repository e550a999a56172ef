package com.yourapp.tracker.habit_tracker.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Runs screens off an explicit stack until it is empty or a screen asks to exit.
 * Going back pops the stack, so a long session never deepens the call stack.
 */
public class ScreenController {
    private static final Logger logger = LoggerFactory.getLogger(ScreenController.class);

    private final ScreenContext context;

    public ScreenController(ScreenContext context) {
        this.context = context;
    }

    public void run(Screen root) throws IOException {
        Deque<Screen> stack = new ArrayDeque<>();
        stack.push(root);

        while (!stack.isEmpty()) {
            Screen screen = stack.peek();
            Navigation next;
            try {
                next = screen.show(context);
            } catch (DataAccessException e) {
                logger.error("Storage failure in {}", screen.getClass().getSimpleName(), e);
                context.message("Something went wrong: " + e.getMostSpecificCause().getMessage());
                next = Navigation.pop();
            }
            logger.debug("{} -> {}", screen.getClass().getSimpleName(), next);

            switch (next.getKind()) {
                case STAY:
                    break;
                case PUSH:
                    stack.push(next.getTarget());
                    break;
                case POP:
                    stack.pop();
                    break;
                case REPLACE:
                    stack.pop();
                    stack.push(next.getTarget());
                    break;
                case EXIT:
                    stack.clear();
                    break;
                default:
                    throw new IllegalStateException("Unknown navigation " + next.getKind());
            }
        }
    }
}
