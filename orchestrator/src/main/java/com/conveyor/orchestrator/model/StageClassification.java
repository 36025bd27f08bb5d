package com.conveyor.orchestrator.model;

/**
 * What kind of work a stage does.
 *
 * The classification drives cross-run behaviour: the trigger bridge looks for
 * the single PUBLISH stage of a CI run, and the health gate owns VERIFY stages.
 */
public enum StageClassification {
    BUILD,
    TEST,
    SECURITY,
    PUBLISH,
    DEPLOY,
    VERIFY
}
