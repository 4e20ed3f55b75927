package io.segmentnav.core.engine;

import static io.segmentnav.core.testkit.TestSchemas.node;
import static io.segmentnav.core.testkit.TestSchemas.token;
import static org.assertj.core.api.Assertions.assertThat;

import io.segmentnav.core.model.NodeKind;
import io.segmentnav.core.model.SchemaNode;
import io.segmentnav.core.model.SchemaTree;
import io.segmentnav.core.testkit.TestSchemas;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * One test per node kind. Order of the returned neighbours is match priority, so every assertion
 * checks exact order.
 */
@DisplayName("NeighbourRule")
class NeighbourRuleTest {

    private final SchemaTree tree = TestSchemas.invoic();

    private static List<String> names(List<SchemaNode> nodes) {
        return nodes.stream().map(SchemaNode::name).toList();
    }

    @Test
    @DisplayName("token → parent only")
    void tokenKind() {
        List<SchemaNode> chain = AncestorChains.ancestorChain(node(tree, "S_CTA"));

        assertThat(names(NeighbourRule.neighbours(node(tree, "S_COM"), chain))).containsExactly("G_CTA");
    }

    @Test
    @DisplayName("group on the chain → remaining children, first child, parent")
    void groupOnChain() {
        List<SchemaNode> chain = AncestorChains.ancestorChain(node(tree, "S_COM"));

        assertThat(names(NeighbourRule.neighbours(node(tree, "G_CTA"), chain)))
                .containsExactly("S_COM", "S_CTA", "G_NAD");
    }

    @Test
    @DisplayName("group off the chain → first child, parent")
    void groupOffChain() {
        List<SchemaNode> chain = AncestorChains.ancestorChain(node(tree, "S_UNH"));

        assertThat(names(NeighbourRule.neighbours(node(tree, "G_NAD"), chain))).containsExactly("S_NAD", "M_INVOIC");
    }

    @Test
    @DisplayName("container on the chain → remaining children, no parent")
    void containerOnChain() {
        List<SchemaNode> chain = AncestorChains.ancestorChain(node(tree, "S_MOA"));

        assertThat(names(NeighbourRule.neighbours(tree.root(), chain))).containsExactly("S_MOA", "S_UNT");
    }

    @Test
    @DisplayName("container off the chain → all children")
    void containerOffChain() {
        SchemaNode root = SchemaNode.builder("G_ROOT")
                .children(token("S_A"), SchemaNode.builder("M_INNER").children(token("S_B"), token("S_C")))
                .build();
        List<SchemaNode> chain = AncestorChains.ancestorChain(root.firstChild());

        assertThat(names(NeighbourRule.neighbours(root.children().get(1), chain))).containsExactly("S_B", "S_C");
    }

    @Test
    @DisplayName("unit → like a container, then parent")
    void unit() {
        SchemaNode root = SchemaNode.builder("M_ROOT")
                .children(SchemaNode.builder("U_HDR").children(token("S_A"), token("S_B")), token("S_C"))
                .build();
        SchemaNode unit = root.firstChild();

        List<SchemaNode> onChain = AncestorChains.ancestorChain(unit.children().get(1));
        assertThat(names(NeighbourRule.neighbours(unit, onChain))).containsExactly("S_B", "M_ROOT");

        List<SchemaNode> offChain = AncestorChains.ancestorChain(root.children().get(1));
        assertThat(names(NeighbourRule.neighbours(unit, offChain))).containsExactly("S_A", "S_B", "M_ROOT");
    }

    @Test
    @DisplayName("wildcard → all children regardless of the chain, then parent")
    void wildcard() {
        SchemaNode root = SchemaNode.builder("M_ROOT")
                .child(SchemaNode.builder("A_ANY").children(token("S_A"), token("S_B")))
                .build();
        SchemaNode wildcard = root.firstChild();
        List<SchemaNode> chain = AncestorChains.ancestorChain(wildcard.children().get(1));

        assertThat(names(NeighbourRule.neighbours(wildcard, chain))).containsExactly("S_A", "S_B", "M_ROOT");
    }

    @Test
    @DisplayName("root and childless group contribute no missing neighbours")
    void missingParentAndFirstChild() {
        SchemaNode root = SchemaNode.builder("G_ROOT", NodeKind.GROUP).build();
        List<SchemaNode> chain = List.of(token("S_X").build());

        assertThat(NeighbourRule.neighbours(root, chain)).isEmpty();
    }
}
