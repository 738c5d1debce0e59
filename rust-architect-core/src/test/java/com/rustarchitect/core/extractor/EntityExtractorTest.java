package com.rustarchitect.core.extractor;

import com.rustarchitect.core.model.Entity;
import com.rustarchitect.core.model.EntityKind;
import com.rustarchitect.core.model.Visibility;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests for {@link EntityExtractor}.
 */
class EntityExtractorTest {

    private EntityExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new EntityExtractor();
    }

    @Test
    void extract_withTwoStructs_returnsBothInSourceOrder() {
        // Given
        String text = """
            pub struct Foo { bar: Bar }
            pub struct Bar;
            """;

        // When
        List<Entity> entities = extractor.extract(text, "src/lib.rs");

        // Then
        assertThat(entities)
            .extracting(Entity::name, Entity::kind, Entity::visibility, Entity::module, Entity::line)
            .containsExactly(
                tuple("Foo", EntityKind.STRUCT, Visibility.PUB, "src/lib.rs", 1),
                tuple("Bar", EntityKind.STRUCT, Visibility.PUB, "src/lib.rs", 2)
            );
    }

    @Test
    void extract_withNoiseNames_dropsThem() {
        // Given
        String text = """
            pub struct Self;
            fn new() -> Self { todo!() }
            fn self_check() {}
            struct Real;
            """;

        // When
        List<Entity> entities = extractor.extract(text, "src/lib.rs");

        // Then
        assertThat(entities).extracting(Entity::name).containsExactly("self_check", "Real");
    }

    @Test
    void extract_withRestrictedVisibility_mapsEachQualifier() {
        // Given
        String text = """
            pub(crate) fn a() {}
            pub(super) struct B;
            pub(self) enum C {}
            pub(in crate::net) trait D {}
            const E: u32 = 1;
            pub static F: &str = "f";
            """;

        // When
        List<Entity> entities = extractor.extract(text, "src/net/mod.rs");

        // Then
        assertThat(entities)
            .extracting(Entity::name, Entity::kind, Entity::visibility)
            .containsExactly(
                tuple("a", EntityKind.FN, Visibility.PUB_CRATE),
                tuple("B", EntityKind.STRUCT, Visibility.PUB_SUPER),
                tuple("C", EntityKind.ENUM, Visibility.PUB_SELF),
                tuple("D", EntityKind.TRAIT, Visibility.PUB_IN),
                tuple("E", EntityKind.CONST, Visibility.PRIVATE),
                tuple("F", EntityKind.STATIC, Visibility.PUB)
            );
    }

    @Test
    void extract_withImplBlocks_recordsThemAsPrivate() {
        // Given
        String text = """
            pub struct Pool<T> { items: Vec<T> }
            impl<T> Pool<T> {
                pub fn take(&mut self) -> impl Iterator<Item = T> + '_ { todo!() }
            }
            impl fmt::Display for Pool<u8> {}
            """;

        // When
        List<Entity> entities = extractor.extract(text, "src/pool.rs");

        // Then
        assertThat(entities)
            .extracting(Entity::name, Entity::kind, Entity::visibility, Entity::line)
            .containsExactly(
                tuple("Pool", EntityKind.STRUCT, Visibility.PUB, 1),
                tuple("Pool", EntityKind.IMPL, Visibility.PRIVATE, 2),
                tuple("take", EntityKind.FN, Visibility.PUB, 3),
                tuple("Display", EntityKind.IMPL, Visibility.PRIVATE, 5)
            );
    }

    @Test
    void extract_withQualifiedDeclarations_recognizesAllKinds() {
        // Given
        String text = """
            pub const fn limit() -> u32 { 8 }
            pub async fn serve() {}
            pub unsafe extern "C" fn callback() {}
            static mut COUNTER: u32 = 0;
            fn describe(label: &'static str) {}
            pub type Result<T> = std::result::Result<T, Error>;
            pub mod net;
            pub unsafe trait Zeroed {}
            """;

        // When
        List<Entity> entities = extractor.extract(text, "src/lib.rs");

        // Then
        assertThat(entities)
            .extracting(Entity::name, Entity::kind, Entity::visibility)
            .containsExactly(
                tuple("limit", EntityKind.FN, Visibility.PUB),
                tuple("serve", EntityKind.FN, Visibility.PUB),
                tuple("callback", EntityKind.FN, Visibility.PUB),
                tuple("COUNTER", EntityKind.STATIC, Visibility.PRIVATE),
                tuple("describe", EntityKind.FN, Visibility.PRIVATE),
                tuple("Result", EntityKind.TYPE, Visibility.PUB),
                tuple("net", EntityKind.MOD, Visibility.PUB),
                tuple("Zeroed", EntityKind.TRAIT, Visibility.PUB)
            );
    }

    @Test
    void extract_withConstGenerics_reportsOnlyConstItems() {
        // Given
        String text = """
            pub struct Buffer<const N: usize> { data: [u8; N] }
            impl<T, const LEN: usize> Default for Array<T, LEN> {}
            fn read<T,
                    const SIZE: usize>() {}
            pub const CAPACITY: usize = 64;
            """;

        // When
        List<Entity> entities = extractor.extract(text, "src/buffer.rs");

        // Then
        assertThat(entities)
            .filteredOn(entity -> entity.kind() == EntityKind.CONST)
            .extracting(Entity::name, Entity::visibility, Entity::line)
            .containsExactly(tuple("CAPACITY", Visibility.PUB, 5));
        assertThat(entities).extracting(Entity::name).contains("Buffer", "read");
    }

    @Test
    void extract_withDocComments_attachesNearestDocumentation() {
        // Given
        String text = """
            /// Adds two numbers
            /// together.
            #[inline]

            pub fn add(a: u32, b: u32) -> u32 { a + b }

            /* plain comment */
            pub fn plain() {}
            /** Creates a pool. */
            pub struct Pool;
            """;

        // When
        List<Entity> entities = extractor.extract(text, "src/lib.rs");

        // Then
        assertThat(entities)
            .extracting(Entity::name, Entity::line, Entity::doc)
            .containsExactly(
                tuple("add", 5, "Adds two numbers\ntogether."),
                tuple("plain", 8, null),
                tuple("Pool", 10, "Creates a pool.")
            );
    }

    @Test
    void extract_withLongDocComment_truncatesTo200Characters() {
        // Given
        String text = "/// " + "x".repeat(300) + "\npub struct Wide;\n";

        // When
        List<Entity> entities = extractor.extract(text, "src/lib.rs");

        // Then
        assertThat(entities).singleElement()
            .satisfies(entity -> assertThat(entity.doc()).hasSize(200));
    }

    @Test
    void extract_calledTwice_returnsEqualResults() {
        // Given
        String text = """
            pub trait Store { fn get(&self); }
            pub struct Memory;
            impl Store for Memory { fn get(&self) {} }
            """;

        // When
        List<Entity> first = extractor.extract(text, "src/store.rs");
        List<Entity> second = extractor.extract(text, "src/store.rs");

        // Then
        assertThat(first).isEqualTo(second);
    }

    @Test
    void extract_withEmptyText_returnsEmptyList() {
        assertThat(extractor.extract("", "src/lib.rs")).isEmpty();
    }

    @Test
    void extract_withNullText_throwsException() {
        assertThatThrownBy(() -> extractor.extract(null, "src/lib.rs"))
            .isInstanceOf(NullPointerException.class);
    }
}
