package com.questrail.barcode.internal.match;

/**
 * Why a run offset cannot be the start of a symbol.
 *
 * <p>These are not errors: the scan simply moves on to the next offset.</p>
 */
public enum SignalRejection
{
    /** The run at the offset is a space; a symbol starts with a bar. */
    LEADING_RUN_LIGHT,

    /** Fewer runs remain than a complete symbol needs. */
    TOO_FEW_RUNS
}
