package io.segmentnav.core.engine;

import io.segmentnav.core.error.StructuralException;
import io.segmentnav.core.model.NodeKind;
import io.segmentnav.core.model.SchemaNode;
import io.segmentnav.core.model.TokenIdentity;

/**
 * Decides whether an input segment is an occurrence of a schema token node.
 *
 * <p>
 * The segment tag must equal the node's wire name. Qualifiers only narrow the match, and only
 * when both sides supply them:
 * <ul>
 * <li>no first value on the segment, or no first qualifiers on the node: match</li>
 * <li>first value among the node's first qualifiers: match, unless the node also declares second
 * qualifiers, the segment carries a second value and that value is not among them</li>
 * <li>otherwise: no match</li>
 * </ul>
 *
 * <p>
 * Thread-safe and stateless.
 */
public final class IdentityMatcher {

    private IdentityMatcher() {}

    /**
     * Tests {@code identity} against {@code tokenNode}.
     *
     * @param tokenNode a schema node of kind {@code TOKEN}
     * @param identity  the input segment's identity
     * @return {@code true} if the segment is an occurrence of the node
     * @throws StructuralException if {@code tokenNode} is not a token node
     */
    public static boolean matches(SchemaNode tokenNode, TokenIdentity identity) {
        if (tokenNode.kind() != NodeKind.TOKEN) {
            throw new StructuralException("Can't compare non segments: " + tokenNode.name(), tokenNode.name());
        }

        if (!tokenNode.wireName().equals(identity.wireName())) {
            return false;
        }

        if (!identity.hasFirstValue() || tokenNode.firstQualifierValues().isEmpty()) {
            return true;
        }

        if (!tokenNode.firstQualifierValues().contains(identity.firstValue())) {
            return false;
        }

        if (!tokenNode.secondQualifierValues().isEmpty() && identity.hasSecondValue()) {
            return tokenNode.secondQualifierValues().contains(identity.secondValue());
        }
        return true;
    }
}
