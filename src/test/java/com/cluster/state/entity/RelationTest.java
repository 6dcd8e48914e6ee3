package com.cluster.state.entity;

import com.cluster.state.StateFixtures;
import com.cluster.state.api.ClusterState;
import com.cluster.state.core.model.Endpoint;
import com.cluster.state.core.model.EndpointRole;
import com.cluster.state.core.model.Life;
import com.cluster.state.core.model.RelationScope;
import com.cluster.state.errors.AlreadyExistsException;
import com.cluster.state.errors.NotAliveException;
import com.cluster.state.errors.NotFoundException;
import com.cluster.state.errors.NotValidException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Relation Tests")
class RelationTest {

    private ClusterState state;
    private Application wordpress;
    private Application mysql;

    @BeforeEach
    void setUp() {
        state = StateFixtures.newState();
        wordpress = StateFixtures.wordpress(state);
        mysql = StateFixtures.mysql(state);
    }

    @AfterEach
    void tearDown() {
        state.close();
    }

    private Relation addRelation() {
        return state.addRelation(StateFixtures.WORDPRESS_DB, StateFixtures.MYSQL_SERVER);
    }

    @Nested
    @DisplayName("Creation")
    class Creation {

        @Test
        @DisplayName("Should key relations by their sorted endpoints")
        void key() {
            Relation relation = addRelation();

            assertEquals("mysql:server wordpress:db", relation.getKey());
            assertEquals(relation.getKey(),
                    Relation.keyOf(List.of(StateFixtures.MYSQL_SERVER, StateFixtures.WORDPRESS_DB)));
            assertEquals(relation.getKey(), state.relation(relation.getId()).getKey());
        }

        @Test
        @DisplayName("Should count the relation on both applications")
        void relationCounts() {
            addRelation();

            wordpress.refresh();
            mysql.refresh();
            assertEquals(1, wordpress.getRelationCount());
            assertEquals(1, mysql.getRelationCount());
            assertEquals(1, wordpress.relations().size());
        }

        @Test
        @DisplayName("Should reject duplicates and mismatched endpoints")
        void invalid() {
            addRelation();

            assertThrows(AlreadyExistsException.class, RelationTest.this::addRelation);
            assertThrows(NotValidException.class,
                    () -> state.addRelation(StateFixtures.WORDPRESS_DB, StateFixtures.WORDPRESS_INFO));
            assertThrows(NotValidException.class, () -> state.addRelation(StateFixtures.MYSQL_SERVER));
        }

        @Test
        @DisplayName("Should accept a single peer endpoint")
        void peer() {
            Application cluster = state.addApplication(AddApplicationArgs.builder("etcd")
                    .series(StateFixtures.SERIES)
                    .charmUrl("ch:etcd-5")
                    .endpoint(Endpoint.of("etcd", "cluster", EndpointRole.PEER, "etcd-raft"))
                    .build());

            Relation relation = state.addRelation(cluster.endpoint("cluster"));

            assertEquals("etcd:cluster", relation.getKey());
            cluster.refresh();
            assertEquals(1, cluster.getRelationCount());
        }

        @Test
        @DisplayName("Should narrow both endpoints to container scope")
        void containerScope() {
            StateFixtures.logging(state);

            Relation relation = state.addRelation(StateFixtures.WORDPRESS_INFO, StateFixtures.LOGGING_INFO);

            assertTrue(relation.getEndpoints().stream().allMatch(ep -> ep.scope() == RelationScope.CONTAINER));
        }

        @Test
        @DisplayName("Should refuse an endpoint the application does not declare")
        void unknownEndpoint() {
            Endpoint bogus = Endpoint.of("mysql", "replica", EndpointRole.PROVIDER, "mysql");

            assertThrows(NotValidException.class, () -> state.addRelation(StateFixtures.WORDPRESS_DB, bogus));
        }
    }

    @Nested
    @DisplayName("Scopes")
    class Scopes {

        @Test
        @DisplayName("Should publish settings to the other side")
        void enterScope() {
            Relation relation = addRelation();
            Unit wp = wordpress.addUnit();
            Unit db = mysql.addUnit();

            relation.unit(wp).enterScope(Map.of("user", "wp"));
            relation.unit(db).enterScope(Map.of("host", "10.0.0.2"));

            RelationUnit ru = relation.unit(wp);
            assertTrue(ru.inScope());
            assertEquals(Map.of("host", "10.0.0.2"), ru.readSettings(db.getName()));
            relation.refresh();
            assertEquals(2, relation.getUnitCount());
        }

        @Test
        @DisplayName("Should treat entering twice as a no-op")
        void enterTwice() {
            Relation relation = addRelation();
            Unit wp = wordpress.addUnit();
            relation.unit(wp).enterScope(Map.of());

            relation.unit(wp).enterScope(Map.of());

            relation.refresh();
            assertEquals(1, relation.getUnitCount());
        }

        @Test
        @DisplayName("Should withdraw settings when leaving")
        void leaveScope() {
            Relation relation = addRelation();
            Unit wp = wordpress.addUnit();
            RelationUnit ru = relation.unit(wp);
            ru.enterScope(Map.of("user", "wp"));

            ru.leaveScope();

            assertFalse(ru.inScope());
            assertThrows(NotFoundException.class, ru::settings);
            relation.refresh();
            assertEquals(0, relation.getUnitCount());
            assertDoesNotThrow(() -> ru.leaveScope());
        }

        @Test
        @DisplayName("Should refuse units that are not members")
        void nonMember() {
            Relation relation = addRelation();
            Unit logging = StateFixtures.logging(state).addSubordinateUnit(wordpress.addUnit());

            assertThrows(NotFoundException.class, () -> relation.unit(logging));
        }
    }

    @Nested
    @DisplayName("Destroy")
    class Destroy {

        @Test
        @DisplayName("Should remove a relation without units in scope")
        void removeIdle() {
            Relation relation = addRelation();

            relation.destroy();

            assertThrows(NotFoundException.class, () -> state.relation(relation.getKey()));
            wordpress.refresh();
            assertEquals(0, wordpress.getRelationCount());
        }

        @Test
        @DisplayName("Should stay dying until the last unit leaves")
        void dyingUntilEmpty() {
            Relation relation = addRelation();
            Unit wp = wordpress.addUnit();
            Unit db = mysql.addUnit();
            relation.unit(wp).enterScope(Map.of());
            relation.unit(db).enterScope(Map.of());

            relation.destroy();
            assertEquals(Life.DYING, relation.getLife());
            assertThrows(NotAliveException.class, () -> relation.unit(mysql.addUnit()).enterScope(Map.of()));

            relation.unit(wp).leaveScope();
            assertEquals(Life.DYING, state.relation(relation.getKey()).getLife());

            relation.unit(db).leaveScope();
            assertThrows(NotFoundException.class, () -> state.relation(relation.getKey()));
            mysql.refresh();
            assertEquals(0, mysql.getRelationCount());
        }

        @Test
        @DisplayName("Should leave every scope when a unit is removed")
        void unitRemovalLeavesScopes() {
            Relation relation = addRelation();
            Unit wp = wordpress.addUnit();
            relation.unit(wp).enterScope(Map.of());

            wp.ensureDead();
            wp.remove();

            relation.refresh();
            assertEquals(0, relation.getUnitCount());
            assertEquals(Life.ALIVE, relation.getLife());
        }
    }
}
