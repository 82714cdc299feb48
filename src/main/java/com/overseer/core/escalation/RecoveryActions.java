package com.overseer.core.escalation;

import com.overseer.core.model.EscalationRecord;
import com.overseer.core.model.Task;

import java.util.List;

/**
 * Side effects the escalation engine asks the coordinator to carry out. The engine decides
 * which strategy applies; the implementation touches processes and workspaces.
 */
public interface RecoveryActions {

    /** Raises a warning about a stuck task without touching the worker. */
    void notifyStuck(Task task, EscalationRecord record);

    /** Sends the cooperative stop request to the worker. */
    void interrupt(Task task, EscalationRecord record);

    /**
     * Terminates the worker and launches a replacement according to the record's strategy. The
     * outcome is reported back asynchronously through {@link EscalationEngine#onRelaunchFailed}
     * or a new watch of the task.
     */
    void restart(Task task, EscalationRecord record);

    /** Fails the task after every strategy has been used up. */
    void fail(Task task, List<EscalationRecord> records);
}
