package FA.Simulation;

import FA.Model.ErrorKind;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of running a string through an automaton.
 * A failed run (unknown symbol, dead configuration, no initial state) is never accepted
 * and keeps the trace accumulated up to the failure point.
 */
public final class SimulationResult {
    private final boolean accepted;
    private final List<TraceStep> trace;
    private final List<String> finalConfiguration;
    private final ErrorKind error;
    private final String message;

    private SimulationResult(boolean accepted, List<TraceStep> trace, List<String> finalConfiguration,
                             ErrorKind error, String message) {
        this.accepted = accepted;
        this.trace = List.copyOf(trace);
        this.finalConfiguration = List.copyOf(finalConfiguration);
        this.error = error;
        this.message = message;
    }

    static SimulationResult completed(boolean accepted, List<TraceStep> trace, List<String> finalConfiguration) {
        String message = (accepted ? "Accepted" : "Rejected") + ", final configuration "
            + TraceStep.format(finalConfiguration);
        return new SimulationResult(accepted, trace, finalConfiguration, null, message);
    }

    static SimulationResult failed(ErrorKind error, String message, List<TraceStep> trace,
                                   List<String> lastConfiguration) {
        return new SimulationResult(false, trace, lastConfiguration, error, message);
    }

    public boolean isAccepted() {
        return accepted;
    }

    public List<TraceStep> getTrace() {
        return trace;
    }

    /**
     * States reached when the run ended; for a failed run, the last configuration before the failure.
     */
    public List<String> getFinalConfiguration() {
        return finalConfiguration;
    }

    public Optional<ErrorKind> getError() {
        return Optional.ofNullable(error);
    }

    public boolean isFailed() {
        return error != null;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return (error == null ? "" : error + ": ") + message + " " + trace;
    }
}
