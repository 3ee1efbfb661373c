package com.virtualcommittee.common.model;

/**
 * Committee verdict. Precedence: REJECT (hard reject) &gt; BUY (≥75) &gt; WATCHLIST (≥60) &gt; SKIP.
 */
public enum Decision {
    BUY,
    WATCHLIST,
    SKIP,
    REJECT
}
