package com.cluster.state.entity;

import com.cluster.state.StateFixtures;
import com.cluster.state.api.ClusterState;
import com.cluster.state.core.model.AssignmentPolicy;
import com.cluster.state.core.model.ContainerType;
import com.cluster.state.core.model.Endpoint;
import com.cluster.state.core.model.EndpointRole;
import com.cluster.state.core.model.MachineJob;
import com.cluster.state.core.model.MachineTemplate;
import com.cluster.state.errors.AlreadyAssignedException;
import com.cluster.state.errors.MachineInUseException;
import com.cluster.state.errors.NotAliveException;
import com.cluster.state.errors.NotAssignedException;
import com.cluster.state.errors.PolicyViolationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Assignment Tests")
class AssignmentTest {

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

    private Machine addMachine() {
        return state.addMachine(MachineTemplate.forSeries(StateFixtures.SERIES));
    }

    @Nested
    @DisplayName("Existing machines")
    class ExistingMachines {

        @Test
        @DisplayName("Should record the unit on the machine and mark it unclean")
        void assign() {
            Machine machine = addMachine();
            Unit unit = wordpress.addUnit();

            unit.assignToMachine(machine);

            assertEquals("0", unit.assignedMachineId());
            machine.refresh();
            assertEquals(List.of(unit.getName()), machine.getPrincipalUnits());
            assertFalse(machine.isClean());
        }

        @Test
        @DisplayName("Should treat assigning to the same machine again as a no-op")
        void sameMachineAgain() {
            Machine machine = addMachine();
            Unit unit = wordpress.addUnit();
            unit.assignToMachine(machine);

            assertDoesNotThrow(() -> unit.assignToMachine(machine));
        }

        @Test
        @DisplayName("Should refuse a second machine")
        void alreadyAssigned() {
            Machine first = addMachine();
            Machine second = addMachine();
            Unit unit = wordpress.addUnit();
            unit.assignToMachine(first);

            assertThrows(AlreadyAssignedException.class, () -> unit.assignToMachine(second));
        }

        @Test
        @DisplayName("Should refuse a machine of another series")
        void seriesMismatch() {
            Machine machine = state.addMachine(MachineTemplate.forSeries("focal"));
            Unit unit = wordpress.addUnit();

            assertThrows(PolicyViolationException.class, () -> unit.assignToMachine(machine));
        }

        @Test
        @DisplayName("Should refuse a machine that cannot host units")
        void noHostingJob() {
            Machine manager = state.addMachine(MachineTemplate.builder()
                    .series(StateFixtures.SERIES)
                    .job(MachineJob.MANAGE_MODEL)
                    .build());
            Unit unit = wordpress.addUnit();

            assertThrows(PolicyViolationException.class, () -> unit.assignToMachine(manager));
        }

        @Test
        @DisplayName("Should refuse to place a subordinate directly")
        void subordinateDirectly() {
            Machine machine = addMachine();
            Unit subordinate = StateFixtures.logging(state).addSubordinateUnit(wordpress.addUnit());

            PolicyViolationException e = assertThrows(PolicyViolationException.class,
                    () -> subordinate.assignToMachine(machine));
            assertTrue(e.getMessage().contains("is a subordinate"));
            assertThrows(PolicyViolationException.class, subordinate::assignToNewMachine);
        }

        @Test
        @DisplayName("Should refuse a dying machine")
        void dyingMachine() {
            Machine machine = addMachine();
            machine.destroy();
            Unit unit = wordpress.addUnit();

            assertThrows(NotAliveException.class, () -> unit.assignToMachine(machine));
        }

        @Test
        @DisplayName("Should refuse a provisioned machine when storage must be attached at provisioning")
        void storageNeedsUnprovisionedMachine() {
            Application db = state.addApplication(AddApplicationArgs.builder("postgresql")
                    .series(StateFixtures.SERIES)
                    .charmUrl("ch:postgresql-4")
                    .endpoint(Endpoint.of("postgresql", "db", EndpointRole.PROVIDER, "pgsql"))
                    .storageRequiresProvisioning(true)
                    .build());
            Machine provisioned = state.addMachine(MachineTemplate.builder()
                    .series(StateFixtures.SERIES)
                    .instanceId("i-1")
                    .build());
            Machine fresh = addMachine();
            Unit unit = db.addUnit();

            assertThrows(PolicyViolationException.class, () -> unit.assignToMachine(provisioned));
            unit.assignToMachine(fresh);
            assertEquals(fresh.getId(), unit.assignedMachineId());
        }

        @Test
        @DisplayName("Should leave the machine unclean after unassigning")
        void unassign() {
            Machine machine = addMachine();
            Unit unit = wordpress.addUnit();
            unit.assignToMachine(machine);

            unit.unassignFromMachine();

            assertThrows(NotAssignedException.class, unit::assignedMachineId);
            machine.refresh();
            assertTrue(machine.getPrincipalUnits().isEmpty());
            assertFalse(machine.isClean());
        }
    }

    @Nested
    @DisplayName("Clean machines")
    class CleanMachines {

        @Test
        @DisplayName("Should use a clean machine and fail once none is left")
        void cleanMachine() {
            Machine machine = addMachine();
            Unit first = wordpress.addUnit();
            Unit second = wordpress.addUnit();

            assertEquals(machine.getId(), first.assignToCleanMachine().getId());

            MachineInUseException e = assertThrows(MachineInUseException.class, second::assignToCleanMachine);
            assertTrue(e.getMessage().contains("all eligible machines in use"));
        }

        @Test
        @DisplayName("Should skip hosts with containers for clean, empty placement")
        void cleanEmptyMachine() {
            Machine host = addMachine();
            state.addMachineInside(MachineTemplate.forSeries(StateFixtures.SERIES), host.getId(), ContainerType.LXD);
            Machine empty = addMachine();
            Unit unit = wordpress.addUnit();

            assertEquals(empty.getId(), unit.assignToCleanEmptyMachine().getId());
        }

        @Test
        @DisplayName("Should skip machines of another series")
        void cleanMachineSeries() {
            state.addMachine(MachineTemplate.forSeries("focal"));
            Unit unit = wordpress.addUnit();

            assertThrows(MachineInUseException.class, unit::assignToCleanMachine);
        }

        @Test
        @DisplayName("Should fall back to a new machine through the assignment policy")
        void policyFallback() {
            Unit unit = wordpress.addUnit();

            Machine machine = state.assignUnit(unit, AssignmentPolicy.CLEAN);

            assertEquals("0", machine.getId());
            assertEquals(List.of(unit.getName()), machine.getPrincipalUnits());
        }

        @Test
        @DisplayName("Should place local units on machine 0")
        void localPolicy() {
            addMachine();
            Unit unit = wordpress.addUnit();

            assertEquals("0", state.assignUnit(unit, AssignmentPolicy.LOCAL).getId());
        }
    }

    @Nested
    @DisplayName("New machines")
    class NewMachines {

        @Test
        @DisplayName("Should create a dedicated machine")
        void newMachine() {
            Unit unit = wordpress.addUnit();

            Machine machine = unit.assignToNewMachine();

            assertEquals(List.of(unit.getName()), machine.getPrincipalUnits());
            assertFalse(machine.isClean());
            assertEquals(StateFixtures.SERIES, machine.getSeries());
        }

        @Test
        @DisplayName("Should honour a container constraint with a new host")
        void containerConstraint() {
            Unit unit = StateFixtures.containerised(state, "cache", ContainerType.LXD).addUnit();

            Machine container = unit.assignToNewMachine();

            assertEquals("0/lxd/0", container.getId());
            assertEquals(ContainerType.LXD, container.getContainerType());
            Machine host = state.machine("0");
            assertEquals(List.of("0/lxd/0"), host.containers());
            assertTrue(host.getPrincipalUnits().isEmpty());
        }

        @Test
        @DisplayName("Should put the container on an existing clean host when one is free")
        void containerOnCleanHost() {
            Machine host = addMachine();
            Unit unit = StateFixtures.containerised(state, "cache", ContainerType.KVM).addUnit();

            Machine container = unit.assignToNewMachineOrContainer();

            assertEquals(host.getId() + "/kvm/0", container.getId());
            assertEquals(1, state.allMachines().stream().filter(m -> !m.isContainer()).count());
        }

        @Test
        @DisplayName("Should give every unit its own machine under concurrent placement")
        void concurrentPlacement() throws Exception {
            List<Unit> units = new ArrayList<>();
            for (int i = 0; i < 50; i++) {
                units.add(wordpress.addUnit());
            }

            ExecutorService executor = Executors.newFixedThreadPool(10);
            List<Future<Machine>> futures = new ArrayList<>();
            for (Unit unit : units) {
                futures.add(executor.submit(() -> state.assignUnit(unit, AssignmentPolicy.NEW)));
            }
            Set<String> machineIds = new HashSet<>();
            for (Future<Machine> future : futures) {
                machineIds.add(future.get(30, TimeUnit.SECONDS).getId());
            }
            executor.shutdown();

            assertEquals(50, machineIds.size());
            assertEquals(50, state.allMachines().size());
        }
    }
}
