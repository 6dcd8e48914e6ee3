package com.cluster.state.entity;

import com.cluster.state.StateFixtures;
import com.cluster.state.api.ClusterState;
import com.cluster.state.core.model.AgentStatus;
import com.cluster.state.core.model.Life;
import com.cluster.state.core.model.MachineJob;
import com.cluster.state.core.model.MachineTemplate;
import com.cluster.state.errors.HasSubordinatesException;
import com.cluster.state.errors.NotDeadException;
import com.cluster.state.errors.NotFoundException;
import com.cluster.state.store.CollectionNames;
import com.cluster.state.store.Condition;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Unit Tests")
class UnitTest {

    private ClusterState state;
    private Application wordpress;

    @BeforeEach
    void setUp() {
        state = StateFixtures.newState();
        wordpress = StateFixtures.wordpress(state);
    }

    @AfterEach
    void tearDown() {
        state.close();
    }

    private long cleanupCount() {
        return state.getContext().store().count(CollectionNames.CLEANUPS, Condition.always());
    }

    @Nested
    @DisplayName("Destroy")
    class Destroy {

        @Test
        @DisplayName("Should remove a unit whose agent never started")
        void removesAllocatingUnit() {
            Unit unit = wordpress.addUnit();

            unit.destroy();

            assertThrows(NotFoundException.class, () -> state.unit("wordpress/0"));
            wordpress.refresh();
            assertEquals(0, wordpress.getUnitCount());
            assertThrows(NotFoundException.class, unit::agentStatus);
        }

        @Test
        @DisplayName("Should set a started unit dying and queue a cleanup")
        void startedUnitBecomesDying() {
            Unit unit = wordpress.addUnit();
            unit.setAgentStatus(AgentStatus.IDLE, "");

            unit.destroy();

            assertEquals(Life.DYING, unit.getLife());
            assertTrue(state.needsCleanup());
            wordpress.refresh();
            assertEquals(1, wordpress.getUnitCount());
        }

        @Test
        @DisplayName("Should always set the unit dying when direct removal is disabled")
        void neverPolicy() {
            try (ClusterState strict = ClusterState.builder()
                    .inMemory()
                    .unitRemovalPolicy(UnitRemovalPolicy.never())
                    .build()) {
                Unit unit = StateFixtures.wordpress(strict).addUnit();

                unit.destroy();

                assertEquals(Life.DYING, strict.unit(unit.getName()).getLife());
            }
        }

        @Test
        @DisplayName("Should be a no-op on a dying unit")
        void destroyTwice() {
            Unit unit = wordpress.addUnit();
            unit.setAgentStatus(AgentStatus.EXECUTING, "installing");
            unit.destroy();

            unit.destroy();

            assertEquals(Life.DYING, state.unit(unit.getName()).getLife());
            assertEquals(1, cleanupCount());
        }

        @Test
        @DisplayName("Should never move a dead unit back")
        void lifeIsMonotonic() {
            Unit unit = wordpress.addUnit();
            unit.ensureDead();

            unit.destroy();

            assertEquals(Life.DEAD, state.unit(unit.getName()).getLife());
        }

        @Test
        @DisplayName("Should set the unit dying exactly once under concurrent destroys")
        void concurrentDestroy() throws Exception {
            Unit unit = wordpress.addUnit();
            unit.setAgentStatus(AgentStatus.IDLE, "");
            String name = unit.getName();

            ExecutorService executor = Executors.newFixedThreadPool(4);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    state.unit(name).destroy();
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
            executor.shutdown();

            assertEquals(Life.DYING, state.unit(name).getLife());
            assertEquals(1, cleanupCount());
        }
    }

    @Nested
    @DisplayName("EnsureDead and Remove")
    class EnsureDeadAndRemove {

        @Test
        @DisplayName("Should remove a dead unit and release its application count")
        void removeDeadUnit() {
            Unit unit = wordpress.addUnit();
            unit.setAgentStatus(AgentStatus.IDLE, "");
            unit.destroy();
            unit.ensureDead();
            assertEquals(Life.DEAD, unit.getLife());

            unit.remove();

            assertThrows(NotFoundException.class, () -> state.unit(unit.getName()));
            wordpress.refresh();
            assertEquals(0, wordpress.getUnitCount());
        }

        @Test
        @DisplayName("Should treat removing a removed unit as a no-op")
        void removeIsIdempotent() {
            Unit unit = wordpress.addUnit();
            unit.ensureDead();
            unit.remove();

            assertDoesNotThrow(unit::remove);
        }

        @Test
        @DisplayName("Should refuse to remove a unit that is not dead")
        void removeAliveUnit() {
            Unit unit = wordpress.addUnit();

            assertThrows(NotDeadException.class, unit::remove);
        }

        @Test
        @DisplayName("Should refuse to kill a principal while subordinates remain")
        void subordinatesBlockDeath() {
            Unit principal = wordpress.addUnit();
            Application logging = StateFixtures.logging(state);
            Unit subordinate = logging.addSubordinateUnit(principal);
            principal.refresh();
            assertEquals(List.of(subordinate.getName()), principal.getSubordinateNames());

            principal.destroy();
            assertEquals(Life.DYING, principal.getLife());

            HasSubordinatesException e = assertThrows(HasSubordinatesException.class, principal::ensureDead);
            assertTrue(e.getMessage().contains("still has subordinate units"));

            assertEquals(1, state.cleanup());
            subordinate.refresh();
            assertEquals(Life.DYING, subordinate.getLife());

            subordinate.ensureDead();
            subordinate.remove();

            principal.refresh();
            assertTrue(principal.getSubordinateNames().isEmpty());
            principal.ensureDead();
            principal.remove();
            assertThrows(NotFoundException.class, () -> state.unit(principal.getName()));
        }
    }

    @Nested
    @DisplayName("Machine cascade")
    class MachineCascade {

        @Test
        @DisplayName("Should set the machine dying when its only unit goes")
        void lastUnitKillsMachine() {
            Unit unit = wordpress.addUnit();
            Machine machine = unit.assignToNewMachine();

            unit.destroy();

            machine.refresh();
            assertEquals(Life.DYING, machine.getLife());
            assertTrue(machine.getPrincipalUnits().isEmpty());
        }

        @Test
        @DisplayName("Should leave a model manager alive")
        void managerSurvives() {
            Machine manager = state.addMachine(MachineTemplate.builder()
                    .series(StateFixtures.SERIES)
                    .job(MachineJob.HOST_UNITS)
                    .job(MachineJob.MANAGE_MODEL)
                    .build());
            Unit unit = wordpress.addUnit();
            unit.assignToMachine(manager);

            unit.destroy();

            manager.refresh();
            assertEquals(Life.ALIVE, manager.getLife());
            assertTrue(manager.getPrincipalUnits().isEmpty());
        }

        @Test
        @DisplayName("Should leave a machine alive while other units remain")
        void sharedMachineSurvives() {
            Machine machine = state.addMachine(MachineTemplate.forSeries(StateFixtures.SERIES));
            Unit first = wordpress.addUnit();
            Unit second = wordpress.addUnit();
            first.assignToMachine(machine);
            second.assignToMachine(machine);

            first.destroy();

            machine.refresh();
            assertEquals(Life.ALIVE, machine.getLife());
            assertEquals(List.of(second.getName()), machine.getPrincipalUnits());
        }
    }

    @Nested
    @DisplayName("Charm references")
    class CharmReferences {

        @Test
        @DisplayName("Should reject a charm the application does not use")
        void unknownCharm() {
            Unit unit = wordpress.addUnit();

            assertThrows(NotFoundException.class, () -> unit.setCharmURL("ch:wordpress-9"));
        }

        @Test
        @DisplayName("Should drop the charm settings with the last unit of a dying application")
        void lastUnitReleasesSettings() {
            Unit unit = wordpress.addUnit();
            unit.setCharmURL("ch:wordpress-1");
            assertEquals("ch:wordpress-1", unit.getCharmURL());

            wordpress.destroy();
            wordpress.refresh();
            assertEquals(Life.DYING, wordpress.getLife());

            state.cleanup();

            assertThrows(NotFoundException.class, () -> state.application("wordpress"));
            assertThrows(NotFoundException.class,
                    () -> state.readSettings(Application.settingsKey("wordpress", "ch:wordpress-1")));
        }
    }

    @Test
    @DisplayName("Should resolve a subordinate's machine through its principal")
    void subordinateMachine() {
        Unit principal = wordpress.addUnit();
        Machine machine = principal.assignToNewMachine();
        Unit subordinate = StateFixtures.logging(state).addSubordinateUnit(principal);

        assertEquals(machine.getId(), subordinate.assignedMachineId());
        assertFalse(subordinate.isPrincipal());
        assertEquals(principal.getName(), subordinate.getPrincipalName());
    }
}
