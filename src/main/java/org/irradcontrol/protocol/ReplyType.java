package org.irradcontrol.protocol;

/**
 * Kind of a command reply.
 */
public enum ReplyType {
    STANDARD,
    ERROR
}
