package com.cluster.state.store;

/**
 * Names of the collections used by the state layer.
 */
public final class CollectionNames {

    public static final String MODEL = "model";
    public static final String APPLICATIONS = "applications";
    public static final String UNITS = "units";
    public static final String MACHINES = "machines";
    public static final String CONTAINER_REFS = "containerrefs";
    public static final String RELATIONS = "relations";
    public static final String RELATION_SCOPES = "relationscopes";
    public static final String STATUSES = "statuses";
    public static final String REFCOUNTS = "refcounts";
    public static final String SETTINGS = "settings";
    public static final String CLEANUPS = "cleanups";
    public static final String SEQUENCE = "sequence";
    public static final String APPLICATION_OFFERS = "applicationoffers";
    public static final String OFFER_CONNECTIONS = "offerconnections";
    public static final String RELATION_NETWORKS = "relationnetworks";

    private CollectionNames() {
    }
}
