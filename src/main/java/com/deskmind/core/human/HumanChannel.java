package com.deskmind.core.human;

import com.deskmind.core.model.HumanReply;

/**
 * Asks the person at the keyboard to confirm a result.
 */
public interface HumanChannel {

    /**
     * Shows {@code prompt} and waits for a yes / no / abort answer.
     * An answer that cannot be read must come back as ABORT.
     */
    HumanReply ask(String prompt);
}
