package com.citationchecker;

public enum CitationType {
    /** {@code (Smith, 2020)} */
    PARENTHETICAL,
    /** {@code Smith (2020)} */
    NARRATIVE
}
