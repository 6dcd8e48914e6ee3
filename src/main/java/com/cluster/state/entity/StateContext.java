package com.cluster.state.entity;

import com.cluster.state.core.model.Life;
import com.cluster.state.errors.NotAliveException;
import com.cluster.state.errors.NotFoundException;
import com.cluster.state.metrics.MetricsService;
import com.cluster.state.settings.SettingsCollection;
import com.cluster.state.store.CollectionNames;
import com.cluster.state.store.Condition;
import com.cluster.state.store.DocumentCodec;
import com.cluster.state.store.DocumentStore;
import com.cluster.state.store.TxnOp;
import com.cluster.state.txn.RefCounts;
import com.cluster.state.txn.Sequences;
import com.cluster.state.txn.TransactionRunner;

import java.util.List;
import java.util.Optional;

/**
 * Collaborators shared by every entity of one state instance: the store,
 * the transaction runner and the counters kept beside the documents.
 */
public class StateContext {

    static final String MODEL_ID = "model";

    private final DocumentStore store;
    private final DocumentCodec codec;
    private final TransactionRunner runner;
    private final Sequences sequences;
    private final RefCounts refCounts;
    private final SettingsCollection settings;
    private final UnitRemovalPolicy removalPolicy;
    private final MetricsService metricsService;

    public StateContext(DocumentStore store, DocumentCodec codec, TransactionRunner runner,
                        UnitRemovalPolicy removalPolicy, MetricsService metricsService) {
        this.store = store;
        this.codec = codec;
        this.runner = runner;
        this.sequences = new Sequences(store, runner);
        this.refCounts = new RefCounts(store);
        this.settings = new SettingsCollection(store, runner);
        this.removalPolicy = removalPolicy;
        this.metricsService = metricsService;
    }

    public DocumentStore store() {
        return store;
    }

    public DocumentCodec codec() {
        return codec;
    }

    public TransactionRunner runner() {
        return runner;
    }

    public Sequences sequences() {
        return sequences;
    }

    public RefCounts refCounts() {
        return refCounts;
    }

    public SettingsCollection settings() {
        return settings;
    }

    public UnitRemovalPolicy removalPolicy() {
        return removalPolicy;
    }

    public MetricsService metrics() {
        return metricsService;
    }

    // ========== Model ==========

    /**
     * Asserts the model is Alive; every add operation carries this op.
     */
    public TxnOp assertModelAliveOp() {
        return TxnOp.on(CollectionNames.MODEL, MODEL_ID).assertThat(LifeAsserts.isAlive()).check();
    }

    /**
     * @throws NotAliveException if the model is Dying or Dead
     */
    public void checkModelAlive() {
        if (model().getLife() != Life.ALIVE) {
            throw new NotAliveException("model is no longer alive");
        }
    }

    public Model model() {
        return new Model(this, store.findOne(CollectionNames.MODEL, MODEL_ID)
                .orElseThrow(() -> new NotFoundException("model not found")));
    }

    // ========== Typed reads ==========

    <T> Optional<T> read(String collection, String id, Class<T> type) {
        return store.findOne(collection, id).map(doc -> codec.fromDocument(doc, type));
    }

    <T> List<T> readMany(String collection, Condition filter, Class<T> type) {
        return store.findMany(collection, filter).stream()
                .map(doc -> codec.fromDocument(doc, type))
                .toList();
    }

    Optional<UnitDoc> unitDoc(String name) {
        return read(CollectionNames.UNITS, name, UnitDoc.class);
    }

    Optional<MachineDoc> machineDoc(String id) {
        return read(CollectionNames.MACHINES, id, MachineDoc.class);
    }

    Optional<ApplicationDoc> applicationDoc(String name) {
        return read(CollectionNames.APPLICATIONS, name, ApplicationDoc.class);
    }

    Optional<RelationDoc> relationDoc(String key) {
        return read(CollectionNames.RELATIONS, key, RelationDoc.class);
    }

    // ========== Entity lookup ==========

    public Unit unit(String name) {
        return new Unit(this, unitDoc(name)
                .orElseThrow(() -> new NotFoundException("unit \"" + name + "\" not found")));
    }

    public Machine machine(String id) {
        return new Machine(this, machineDoc(id)
                .orElseThrow(() -> new NotFoundException("machine " + id + " not found")));
    }

    public Application application(String name) {
        return new Application(this, applicationDoc(name)
                .orElseThrow(() -> new NotFoundException("application \"" + name + "\" not found")));
    }

    public Relation relation(String key) {
        return new Relation(this, relationDoc(key)
                .orElseThrow(() -> new NotFoundException("relation \"" + key + "\" not found")));
    }

    public Relation relationById(long id) {
        return readMany(CollectionNames.RELATIONS, Condition.eq(RelationDoc.ID, id), RelationDoc.class).stream()
                .findFirst()
                .map(doc -> new Relation(this, doc))
                .orElseThrow(() -> new NotFoundException("relation " + id + " not found"));
    }

    public List<Unit> units(String applicationName) {
        return readMany(CollectionNames.UNITS, Condition.eq(UnitDoc.APPLICATION, applicationName), UnitDoc.class)
                .stream().map(doc -> new Unit(this, doc)).toList();
    }

    public List<Machine> machines() {
        return readMany(CollectionNames.MACHINES, Condition.always(), MachineDoc.class)
                .stream().map(doc -> new Machine(this, doc)).toList();
    }

    public List<Application> applications() {
        return readMany(CollectionNames.APPLICATIONS, Condition.always(), ApplicationDoc.class)
                .stream().map(doc -> new Application(this, doc)).toList();
    }

    public List<Relation> relations() {
        return readMany(CollectionNames.RELATIONS, Condition.always(), RelationDoc.class)
                .stream().map(doc -> new Relation(this, doc)).toList();
    }

    List<Relation> relationsOf(String applicationName) {
        return readMany(CollectionNames.RELATIONS,
                Condition.contains(RelationDoc.APPLICATIONS, applicationName), RelationDoc.class)
                .stream().map(doc -> new Relation(this, doc)).toList();
    }
}
