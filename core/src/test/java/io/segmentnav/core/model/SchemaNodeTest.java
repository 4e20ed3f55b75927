package io.segmentnav.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.segmentnav.core.error.StructuralException;
import io.segmentnav.core.testkit.TestSchemas;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SchemaNode")
class SchemaNodeTest {

    @Test
    @DisplayName("build wires parent back-references and keeps declaration order")
    void buildWiresParents() {
        SchemaNode root = SchemaNode.builder("M_ORDERS")
                .children(SchemaNode.builder("S_UNH"), SchemaNode.builder("G_NAD").child(SchemaNode.builder("S_NAD")))
                .build();

        assertThat(root.isRoot()).isTrue();
        assertThat(root.parent()).isNull();
        assertThat(root.children()).extracting(SchemaNode::name).containsExactly("S_UNH", "G_NAD");
        SchemaNode group = root.children().get(1);
        assertThat(group.parent()).isSameAs(root);
        assertThat(group.firstChild().parent()).isSameAs(group);
        assertThat(group.firstChild().depth()).isEqualTo(2);
    }

    @Test
    @DisplayName("kind is inferred from the name prefix, wire name from the rest")
    void defaultsFromName() {
        SchemaNode node = SchemaNode.builder("S_NAD").build();

        assertThat(node.kind()).isEqualTo(NodeKind.TOKEN);
        assertThat(node.wireName()).isEqualTo("NAD");
        assertThat(node.isTrigger()).isFalse();
        assertThat(node.firstQualifierValues()).isEmpty();
        assertThat(node.secondQualifierValues()).isEmpty();
        assertThat(node.firstChild()).isNull();
    }

    @Test
    @DisplayName("explicit wire name, trigger and qualifiers are kept")
    void explicitAttributes() {
        SchemaNode node = SchemaNode.builder("S_DTM_LIN", NodeKind.TOKEN)
                .wireName("DTM")
                .trigger(true)
                .firstQualifiers("137", "2")
                .secondQualifiers("102")
                .build();

        assertThat(node.wireName()).isEqualTo("DTM");
        assertThat(node.isTrigger()).isTrue();
        assertThat(node.firstQualifierValues()).containsExactly("137", "2");
        assertThat(node.secondQualifierValues()).containsExactly("102");
    }

    @Test
    @DisplayName("name without prefix keeps the whole name as wire name")
    void unprefixedNameIsItsOwnWireName() {
        SchemaNode node = SchemaNode.builder("LOOP", NodeKind.GROUP).build();

        assertThat(node.wireName()).isEqualTo("LOOP");
    }

    @Test
    @DisplayName("children and qualifier sets are unmodifiable")
    void collectionsAreUnmodifiable() {
        SchemaNode root = TestSchemas.invoic().root();

        assertThatThrownBy(() -> root.children().clear()).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> root.firstQualifierValues().add("X"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("a definition nested inside itself is rejected")
    void selfNestingRejected() {
        SchemaNode.Builder group = SchemaNode.builder("G_LOOP");

        assertThatThrownBy(() -> group.child(group))
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("G_LOOP");
    }

    @Test
    @DisplayName("an ancestor cannot be added below its own descendant")
    void ancestorCycleRejected() {
        SchemaNode.Builder outer = SchemaNode.builder("G_OUTER");
        SchemaNode.Builder inner = SchemaNode.builder("G_INNER");
        outer.child(inner);

        assertThatThrownBy(() -> inner.child(outer))
                .isInstanceOf(StructuralException.class)
                .extracting(e -> ((StructuralException) e).nodeName())
                .isEqualTo("G_OUTER");
    }

    @Test
    @DisplayName("a definition cannot be shared by two parents")
    void sharedChildRejected() {
        SchemaNode.Builder shared = SchemaNode.builder("S_NAD");
        SchemaNode.builder("G_A").child(shared);

        assertThatThrownBy(() -> SchemaNode.builder("G_B").child(shared))
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("already a child of G_A");
    }
}
