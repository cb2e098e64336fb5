package com.phillippitts.council.domain;

public enum Recommendation {
    APPROVE,
    REVISE
}
