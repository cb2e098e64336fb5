package com.phillippitts.council.service.governor;

/**
 * Why a priced call was made. Recorded on every ledger entry.
 */
public enum CallPurpose {
    CLASSIFY,
    SUMMARIZE,
    STAGE1,
    STAGE2,
    STAGE3,
    STAGE4,
    TOOL
}
