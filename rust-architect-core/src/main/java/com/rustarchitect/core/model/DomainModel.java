package com.rustarchitect.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Public domain types declared in the production sources.
 *
 * <p>Field and variant lists hold at most {@link #MEMBER_LIMIT} names each; alias
 * targets are cut to {@link #TARGET_LIMIT} characters.
 *
 * @param structs public structs with braced bodies, file then position order
 * @param enums public enums
 * @param typeAliases public type aliases
 * @param traits public traits
 */
public record DomainModel(
    List<StructType> structs,
    List<EnumType> enums,
    List<TypeAlias> typeAliases,
    List<TraitType> traits
) {
    public static final int MEMBER_LIMIT = 5;
    public static final int TARGET_LIMIT = 50;

    public DomainModel {
        structs = structs == null ? List.of() : List.copyOf(structs);
        enums = enums == null ? List.of() : List.copyOf(enums);
        typeAliases = typeAliases == null ? List.of() : List.copyOf(typeAliases);
        traits = traits == null ? List.of() : List.copyOf(traits);
    }

    public static DomainModel empty() {
        return new DomainModel(List.of(), List.of(), List.of(), List.of());
    }

    /**
     * @param name struct name
     * @param fields first named fields
     * @param file project-relative file path
     */
    public record StructType(String name, List<String> fields, String file) {
        public StructType {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(file, "file must not be null");
            fields = fields == null ? List.of() : List.copyOf(fields);
        }
    }

    /**
     * @param name enum name
     * @param variants first variant names
     * @param file project-relative file path
     */
    public record EnumType(String name, List<String> variants, String file) {
        public EnumType {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(file, "file must not be null");
            variants = variants == null ? List.of() : List.copyOf(variants);
        }
    }

    /**
     * @param name alias name
     * @param target aliased type, whitespace collapsed
     * @param file project-relative file path
     */
    public record TypeAlias(String name, String target, String file) {
        public TypeAlias {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(target, "target must not be null");
            Objects.requireNonNull(file, "file must not be null");
        }
    }

    public record TraitType(String name, String file) {
        public TraitType {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(file, "file must not be null");
        }
    }
}
