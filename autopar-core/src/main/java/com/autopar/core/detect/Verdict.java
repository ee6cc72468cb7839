package com.autopar.core.detect;

public enum Verdict {
    ACCEPTED,
    REJECTED
}
