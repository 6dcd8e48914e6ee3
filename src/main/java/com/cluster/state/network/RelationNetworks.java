package com.cluster.state.network;

import com.cluster.state.entity.StateContext;
import com.cluster.state.errors.NotFoundException;
import com.cluster.state.errors.NotValidException;
import com.cluster.state.store.CollectionNames;
import com.cluster.state.store.Condition;
import com.cluster.state.store.Documents;
import com.cluster.state.store.TxnOp;
import com.cluster.state.store.Update;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ingress or egress networks of relations, keyed by relation key.
 */
public class RelationNetworks {

    private static final Logger log = LoggerFactory.getLogger(RelationNetworks.class);

    static final String RELATION_KEY = "relation-key";
    static final String DIRECTION = "direction";
    static final String CIDRS = "cidrs";

    private static final Pattern IPV4_ADDRESS = Pattern.compile(
            "^(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})$");
    private static final Pattern HEXTET = Pattern.compile("^[0-9a-fA-F]{1,4}$");
    private static final Pattern PREFIX = Pattern.compile("^\\d{1,3}$");
    private static final int IPV6_GROUPS = 8;

    private final StateContext ctx;
    private final RelationNetworkDirection direction;

    public RelationNetworks(StateContext ctx, RelationNetworkDirection direction) {
        this.ctx = ctx;
        this.direction = direction;
    }

    public RelationNetworkDirection getDirection() {
        return direction;
    }

    static String docId(RelationNetworkDirection direction, String relationKey) {
        return direction.prefix() + "#" + relationKey;
    }

    /**
     * Records the CIDRs for a relation, replacing any recorded before.
     *
     * @throws NotValidException if a CIDR is malformed
     * @throws NotFoundException if the relation does not exist
     */
    public RelationNetwork save(String relationKey, List<String> cidrs) {
        for (String cidr : cidrs) {
            validateCidr(cidr);
        }
        String id = docId(direction, relationKey);
        List<String> values = List.copyOf(cidrs);
        ctx.runner().run("save " + direction.prefix() + " networks for " + relationKey, attempt -> {
            if (ctx.store().findOne(CollectionNames.RELATIONS, relationKey).isEmpty()) {
                throw new NotFoundException("relation \"" + relationKey + "\" not found");
            }
            List<TxnOp> ops = new ArrayList<>();
            ops.add(TxnOp.on(CollectionNames.RELATIONS, relationKey)
                    .assertThat(Condition.docExists())
                    .check());
            if (ctx.store().findOne(CollectionNames.RELATION_NETWORKS, id).isPresent()) {
                ops.add(TxnOp.on(CollectionNames.RELATION_NETWORKS, id)
                        .assertThat(Condition.docExists())
                        .update(new Update().set(CIDRS, values)));
            } else {
                ops.add(TxnOp.on(CollectionNames.RELATION_NETWORKS, id)
                        .assertThat(Condition.docMissing())
                        .insert(Map.of(RELATION_KEY, relationKey, DIRECTION, direction.name(), CIDRS, values)));
            }
            return ops;
        });
        log.debug("Saved {} networks {} for relation {}", direction.prefix(), values, relationKey);
        return new RelationNetwork(relationKey, direction, values);
    }

    /**
     * @throws NotFoundException if nothing is recorded for the relation
     */
    public RelationNetwork networks(String relationKey) {
        return ctx.store().findOne(CollectionNames.RELATION_NETWORKS, docId(direction, relationKey))
                .map(this::toNetwork)
                .orElseThrow(() -> new NotFoundException(
                        direction.prefix() + " networks for relation \"" + relationKey + "\" not found"));
    }

    public List<RelationNetwork> allNetworks() {
        return ctx.store().findMany(CollectionNames.RELATION_NETWORKS,
                        Condition.eq(DIRECTION, direction.name())).stream()
                .map(this::toNetwork)
                .toList();
    }

    /**
     * Forgets the networks of a relation. Returns whether anything was removed.
     */
    public boolean remove(String relationKey) {
        String id = docId(direction, relationKey);
        AtomicBoolean removed = new AtomicBoolean();
        ctx.runner().run("remove " + direction.prefix() + " networks for " + relationKey, attempt -> {
            removed.set(false);
            if (ctx.store().findOne(CollectionNames.RELATION_NETWORKS, id).isEmpty()) {
                return List.of();
            }
            removed.set(true);
            return List.of(TxnOp.on(CollectionNames.RELATION_NETWORKS, id)
                    .assertThat(Condition.docExists())
                    .remove());
        });
        return removed.get();
    }

    /**
     * Ops removing the networks of a relation in both directions.
     */
    public static List<TxnOp> removeOps(String relationKey) {
        List<TxnOp> ops = new ArrayList<>();
        for (RelationNetworkDirection d : RelationNetworkDirection.values()) {
            ops.add(TxnOp.on(CollectionNames.RELATION_NETWORKS, docId(d, relationKey)).remove());
        }
        return ops;
    }

    private RelationNetwork toNetwork(Map<String, Object> doc) {
        List<String> cidrs = Documents.listValue(doc, CIDRS).stream().map(String::valueOf).toList();
        return new RelationNetwork(Documents.stringValue(doc, RELATION_KEY), direction, cidrs);
    }

    static void validateCidr(String cidr) {
        if (cidr == null || !isValidCidr(cidr)) {
            throw new NotValidException("CIDR \"" + cidr + "\" not valid");
        }
    }

    private static boolean isValidCidr(String cidr) {
        int slash = cidr.indexOf('/');
        if (slash < 0 || cidr.indexOf('/', slash + 1) >= 0) {
            return false;
        }
        String address = cidr.substring(0, slash);
        String prefix = cidr.substring(slash + 1);
        if (!PREFIX.matcher(prefix).matches()) {
            return false;
        }
        int bits = Integer.parseInt(prefix);
        if (address.indexOf(':') < 0) {
            return bits <= 32 && isValidIpv4(address);
        }
        return bits <= 128 && isValidIpv6(address);
    }

    private static boolean isValidIpv4(String address) {
        Matcher m = IPV4_ADDRESS.matcher(address);
        if (!m.matches()) {
            return false;
        }
        for (int i = 1; i <= 4; i++) {
            if (Integer.parseInt(m.group(i)) > 255) {
                return false;
            }
        }
        return true;
    }

    /**
     * Accepts the textual IPv6 forms: eight hextets, or fewer with a single
     * "::" standing for the missing zero groups, optionally ending in an
     * embedded IPv4 address that counts as two groups.
     */
    private static boolean isValidIpv6(String address) {
        int gap = address.indexOf("::");
        if (gap < 0) {
            return countGroups(address) == IPV6_GROUPS;
        }
        if (address.indexOf("::", gap + 1) >= 0) {
            return false;
        }
        String head = address.substring(0, gap);
        String tail = address.substring(gap + 2);
        if (head.indexOf('.') >= 0) {
            return false;
        }
        int headGroups = head.isEmpty() ? 0 : countGroups(head);
        int tailGroups = tail.isEmpty() ? 0 : countGroups(tail);
        return headGroups >= 0 && tailGroups >= 0 && headGroups + tailGroups < IPV6_GROUPS;
    }

    /** Returns the number of 16-bit groups in a colon-separated run, or -1 if it is malformed. */
    private static int countGroups(String run) {
        String[] parts = run.split(":", -1);
        int groups = 0;
        for (int i = 0; i < parts.length; i++) {
            String part = parts[i];
            if (i == parts.length - 1 && part.indexOf('.') >= 0) {
                if (!isValidIpv4(part)) {
                    return -1;
                }
                groups += 2;
            } else if (HEXTET.matcher(part).matches()) {
                groups++;
            } else {
                return -1;
            }
        }
        return groups;
    }
}
