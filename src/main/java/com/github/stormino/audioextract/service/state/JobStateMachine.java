package com.github.stormino.audioextract.service.state;

import com.github.stormino.audioextract.model.JobStatus;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * State machine for conversion job status transitions.
 *
 * Valid state flow:
 * <pre>
 * QUEUED → RUNNING → COMPLETED
 *    ↓        ↓
 *    ↓     FAILED / CANCELLED
 *    ↓
 * CANCELLED / SKIPPED / FAILED (pool rejected the job)
 * </pre>
 */
@Component
@Slf4j
public class JobStateMachine {

    private final Map<JobStatus, Set<JobStatus>> validTransitions;

    public JobStateMachine() {
        validTransitions = new EnumMap<>(JobStatus.class);
        initializeTransitions();
    }

    private void initializeTransitions() {
        validTransitions.put(JobStatus.QUEUED,
            EnumSet.of(JobStatus.RUNNING, JobStatus.CANCELLED, JobStatus.SKIPPED, JobStatus.FAILED));

        validTransitions.put(JobStatus.RUNNING,
            EnumSet.of(JobStatus.COMPLETED, JobStatus.FAILED, JobStatus.CANCELLED));

        // Terminal states (no transitions)
        validTransitions.put(JobStatus.COMPLETED, EnumSet.noneOf(JobStatus.class));
        validTransitions.put(JobStatus.FAILED, EnumSet.noneOf(JobStatus.class));
        validTransitions.put(JobStatus.CANCELLED, EnumSet.noneOf(JobStatus.class));
        validTransitions.put(JobStatus.SKIPPED, EnumSet.noneOf(JobStatus.class));
    }

    /**
     * Check if a state transition is valid. Unlike a status refresh, staying in the
     * same state is not a transition.
     *
     * @param currentState Current state
     * @param newState Desired new state
     * @return true if transition is valid
     */
    public boolean isValidTransition(@NonNull JobStatus currentState, @NonNull JobStatus newState) {
        Set<JobStatus> allowedTransitions = validTransitions.get(currentState);
        return allowedTransitions != null && allowedTransitions.contains(newState);
    }

    /**
     * Compare-and-set style transition.
     *
     * @param jobId Job ID for logging
     * @param currentState Current state
     * @param newState Desired new state
     * @return true if the caller may apply {@code newState}, false if the change is rejected
     */
    public boolean transition(
            @NonNull String jobId,
            @NonNull JobStatus currentState,
            @NonNull JobStatus newState) {

        if (isValidTransition(currentState, newState)) {
            log.debug("Job {} state transition: {} → {}", jobId, currentState, newState);
            return true;
        }

        log.debug("Job {} state transition rejected: {} → {}", jobId, currentState, newState);
        return false;
    }

    /**
     * Check if a state is terminal (no further transitions possible).
     */
    public boolean isTerminalState(@NonNull JobStatus state) {
        Set<JobStatus> allowedTransitions = validTransitions.get(state);
        return allowedTransitions == null || allowedTransitions.isEmpty();
    }

    /**
     * Get all valid next states from current state.
     */
    public Set<JobStatus> getValidNextStates(@NonNull JobStatus currentState) {
        Set<JobStatus> states = validTransitions.get(currentState);
        return states != null && !states.isEmpty() ? EnumSet.copyOf(states) : EnumSet.noneOf(JobStatus.class);
    }
}
