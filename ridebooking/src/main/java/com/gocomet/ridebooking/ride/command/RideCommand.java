package com.gocomet.ridebooking.ride.command;

/**
 * Intent applied to an existing ride. Each implementation names exactly the
 * fields it may change.
 */
public interface RideCommand {

    /** Verb used in rejection messages, e.g. "cancel". */
    String verb();
}
