package com.cluster.state.offer;

import com.cluster.state.entity.StateContext;
import com.cluster.state.errors.AlreadyExistsException;
import com.cluster.state.errors.NotFoundException;
import com.cluster.state.store.CollectionNames;
import com.cluster.state.store.Condition;
import com.cluster.state.store.TxnOp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Records which relations consume which offers, one document per relation id.
 */
public class OfferConnections {

    private static final Logger log = LoggerFactory.getLogger(OfferConnections.class);

    private final StateContext ctx;

    public OfferConnections(StateContext ctx) {
        this.ctx = ctx;
    }

    /**
     * @throws AlreadyExistsException if the relation already has a connection
     * @throws NotFoundException      if the relation does not exist
     */
    public OfferConnection addOfferConnection(AddOfferConnectionArgs args) {
        String id = String.valueOf(args.relationId());
        OfferConnectionDoc doc = new OfferConnectionDoc(id, args.offerUUID(), args.relationId(),
                args.relationKey(), args.username(), args.sourceModelUUID(), 0);
        ctx.runner().run("add offer connection " + id, attempt -> {
            ctx.checkModelAlive();
            if (ctx.store().findOne(CollectionNames.OFFER_CONNECTIONS, id).isPresent()) {
                throw new AlreadyExistsException("offer connection for relation " + id + " already exists");
            }
            if (ctx.store().findOne(CollectionNames.RELATIONS, args.relationKey()).isEmpty()) {
                throw new NotFoundException("relation \"" + args.relationKey() + "\" not found");
            }
            return List.of(
                    ctx.assertModelAliveOp(),
                    TxnOp.on(CollectionNames.RELATIONS, args.relationKey())
                            .assertThat(Condition.docExists())
                            .check(),
                    TxnOp.on(CollectionNames.OFFER_CONNECTIONS, id)
                            .assertThat(Condition.docMissing())
                            .insert(ctx.codec().toDocument(doc)));
        });
        log.debug("Relation {} now consumes offer {}", args.relationKey(), args.offerUUID());
        return doc.toConnection();
    }

    public List<OfferConnection> offerConnections(String offerUUID) {
        return ctx.store().findMany(CollectionNames.OFFER_CONNECTIONS,
                        Condition.eq(OfferConnectionDoc.OFFER_UUID, offerUUID)).stream()
                .map(d -> ctx.codec().fromDocument(d, OfferConnectionDoc.class).toConnection())
                .toList();
    }

    /**
     * @throws NotFoundException if the relation has no offer connection
     */
    public OfferConnection offerConnectionForRelation(String relationKey) {
        return ctx.store().findMany(CollectionNames.OFFER_CONNECTIONS,
                        Condition.eq(OfferConnectionDoc.RELATION_KEY, relationKey)).stream()
                .findFirst()
                .map(d -> ctx.codec().fromDocument(d, OfferConnectionDoc.class).toConnection())
                .orElseThrow(() -> new NotFoundException(
                        "offer connection for relation \"" + relationKey + "\" not found"));
    }

    /**
     * Op removing the connection of a relation, if there is one.
     */
    public static TxnOp removeOp(long relationId) {
        return TxnOp.on(CollectionNames.OFFER_CONNECTIONS, String.valueOf(relationId)).remove();
    }
}
