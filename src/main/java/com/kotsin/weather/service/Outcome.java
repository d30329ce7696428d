package com.kotsin.weather.service;

import com.kotsin.weather.domain.model.Diagnostic;
import com.kotsin.weather.exception.WeatherInsightException;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Success-with-diagnostics or terminal failure.
 *
 * A successful outcome may still carry diagnostics of sub-models or detectors that did not contribute;
 * a failed outcome carries the terminal exception instead of a value.
 */
@Getter
@ToString
public final class Outcome<T> {

    private final boolean success;
    private final T value;
    private final List<Diagnostic> diagnostics;
    private final WeatherInsightException failure;
    private final Instant timestamp;

    private Outcome(boolean success, T value, List<Diagnostic> diagnostics, WeatherInsightException failure) {
        this.success = success;
        this.value = value;
        this.diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
        this.failure = failure;
        this.timestamp = Instant.now();
    }

    // ---------- factories ----------
    public static <T> Outcome<T> success(T value, List<Diagnostic> diagnostics) {
        return new Outcome<>(true, Objects.requireNonNull(value, "value"), diagnostics, null);
    }

    public static <T> Outcome<T> failure(WeatherInsightException failure) {
        return new Outcome<>(false, null, List.of(), Objects.requireNonNull(failure, "failure"));
    }

    // ---------- helpers ----------

    public boolean isFailure() {
        return !success;
    }

    /**
     * Error code of the terminal failure, null on success
     */
    public String getErrorCode() {
        return failure == null ? null : failure.getErrorCode();
    }

    /**
     * The value, or the terminal failure rethrown
     */
    public T getOrThrow() {
        if (!success) {
            throw failure;
        }
        return value;
    }

    /**
     * Maps the value when successful; propagates the failure otherwise.
     */
    public <R> Outcome<R> map(Function<? super T, ? extends R> mapper) {
        Objects.requireNonNull(mapper, "mapper");
        if (!success) {
            return Outcome.failure(failure);
        }
        return Outcome.success(mapper.apply(value), diagnostics);
    }
}
