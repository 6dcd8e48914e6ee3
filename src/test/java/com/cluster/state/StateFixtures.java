package com.cluster.state;

import com.cluster.state.api.ClusterState;
import com.cluster.state.core.model.Constraints;
import com.cluster.state.core.model.ContainerType;
import com.cluster.state.core.model.Endpoint;
import com.cluster.state.core.model.EndpointRole;
import com.cluster.state.core.model.RelationScope;
import com.cluster.state.entity.AddApplicationArgs;
import com.cluster.state.entity.Application;

/**
 * Applications shared by the state tests.
 */
public final class StateFixtures {

    public static final String SERIES = "jammy";

    public static final Endpoint WORDPRESS_DB = Endpoint.of("wordpress", "db", EndpointRole.REQUIRER, "mysql");
    public static final Endpoint WORDPRESS_INFO =
            Endpoint.of("wordpress", "juju-info", EndpointRole.PROVIDER, "juju-info");
    public static final Endpoint MYSQL_SERVER = Endpoint.of("mysql", "server", EndpointRole.PROVIDER, "mysql");
    public static final Endpoint LOGGING_INFO =
            new Endpoint("logging", "info", EndpointRole.REQUIRER, "juju-info", RelationScope.CONTAINER);

    private StateFixtures() {
    }

    public static ClusterState newState() {
        return ClusterState.builder().inMemory().build();
    }

    public static Application wordpress(ClusterState state) {
        return state.addApplication(AddApplicationArgs.builder("wordpress")
                .series(SERIES)
                .charmUrl("ch:wordpress-1")
                .endpoint(WORDPRESS_DB)
                .endpoint(WORDPRESS_INFO)
                .setting("blog-title", "My Blog")
                .build());
    }

    public static Application mysql(ClusterState state) {
        return state.addApplication(AddApplicationArgs.builder("mysql")
                .series(SERIES)
                .charmUrl("ch:mysql-3")
                .endpoint(MYSQL_SERVER)
                .build());
    }

    public static Application logging(ClusterState state) {
        return state.addApplication(AddApplicationArgs.builder("logging")
                .series(SERIES)
                .charmUrl("ch:logging-2")
                .subordinate(true)
                .endpoint(LOGGING_INFO)
                .build());
    }

    public static Application containerised(ClusterState state, String name, ContainerType type) {
        return state.addApplication(AddApplicationArgs.builder(name)
                .series(SERIES)
                .charmUrl("ch:" + name + "-1")
                .constraints(Constraints.container(type))
                .build());
    }
}
