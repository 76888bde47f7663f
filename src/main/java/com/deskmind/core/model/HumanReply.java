package com.deskmind.core.model;

import java.io.Serializable;

/**
 * Reply from the human channel.
 *
 * @param decision yes / no / abort
 * @param context  optional free text explaining what is wrong (used on "no")
 */
public record HumanReply(
    HumanDecision decision,
    String context
) implements Serializable {

    public HumanReply {
        decision = decision == null ? HumanDecision.ABORT : decision;
        context = context == null ? "" : context;
    }
}
