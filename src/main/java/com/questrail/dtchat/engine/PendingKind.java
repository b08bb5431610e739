package com.questrail.dtchat.engine;

/**
 * What an in-flight send carries.
 */
public enum PendingKind
{
    /** An acknowledgement for a received message. */
    ACK,

    /** A locally authored Text or File message. */
    TEXT
}
