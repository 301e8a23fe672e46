package org.simpleweather.engine;

/** What a time update did to this instance. */
public enum UpdateOutcome {
    /** Absent or partial reading; nothing changed. */
    IGNORED,
    /** Only the local view's time moved. */
    REFRESHED,
    /** The existing record got its first calendar reading and was committed without regenerating. */
    ADOPTED,
    /** New weather was generated and committed. */
    REGENERATED
}
