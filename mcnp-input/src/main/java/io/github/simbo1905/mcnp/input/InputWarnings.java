package io.github.simbo1905.mcnp.input;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Supplier;
import java.util.logging.Logger;

/// Collects [InputWarning]s raised on the current thread.
///
/// Every warning is logged at WARNING. Callers that want the warnings as values wrap their work in
/// [#capture(Supplier)]; captures nest and each enclosing scope sees the warnings of the inner ones.
public final class InputWarnings {

    private static final Logger LOG = Logger.getLogger(InputWarnings.class.getName());

    private static final ThreadLocal<Deque<List<InputWarning>>> SCOPES = ThreadLocal.withInitial(ArrayDeque::new);

    /// The value produced inside a capture scope with the warnings raised while producing it.
    public record Captured<T>(T value, List<InputWarning> warnings) {
        public Captured {
            warnings = List.copyOf(warnings);
        }
    }

    private InputWarnings() {}

    /// Records a warning in every open scope on this thread and logs it.
    public static void warn(InputWarning warning) {
        LOG.warning(() -> StructuredLog.ev("input_warning", "kind", warning.kind(), "message", warning.message()));
        for (List<InputWarning> scope : SCOPES.get()) {
            scope.add(warning);
        }
    }

    public static void warn(InputWarning.Kind kind, String message) {
        warn(InputWarning.of(kind, message));
    }

    public static <T> Captured<T> capture(Supplier<T> work) {
        final var scopes = SCOPES.get();
        final var collected = new ArrayList<InputWarning>();
        scopes.push(collected);
        try {
            final T value = work.get();
            return new Captured<>(value, collected);
        } finally {
            scopes.pop();
            if (scopes.isEmpty()) {
                SCOPES.remove();
            }
        }
    }

    public static List<InputWarning> capture(Runnable work) {
        return capture(() -> {
            work.run();
            return null;
        }).warnings();
    }
}
