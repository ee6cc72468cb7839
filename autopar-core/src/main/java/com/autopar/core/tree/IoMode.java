package com.autopar.core.tree;

public enum IoMode {
    READ,
    WRITE
}
