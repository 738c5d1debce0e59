package com.rustarchitect.core.extractor;

import com.rustarchitect.core.model.EntityKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Precompiled lexical patterns for Rust declarations and cross references.
 *
 * <p>Declaration patterns expose two named groups: {@code vis} (the optional
 * visibility qualifier) and {@code name} (the declared identifier). Patterns are
 * compiled once at class loading time.
 */
public final class RustPatterns {

    /** Group holding the visibility qualifier, absent for private items. */
    public static final String GROUP_VISIBILITY = "vis";

    /** Group holding the declared identifier. */
    public static final String GROUP_NAME = "name";

    private static final String IDENT = "[A-Za-z_][A-Za-z0-9_]*";
    private static final String VISIBILITY = "(?<vis>\\bpub(?:\\s*\\([^)]*\\))?\\s+)?";
    private static final String NAME = "(?<name>" + IDENT + ")";
    // one level of nested angle brackets: <T>, <K, Vec<V>>
    private static final String GENERICS = "<(?:[^<>]|<[^<>]*>)*>";
    private static final String PATH_PREFIX = "(?:" + IDENT + "::)*";

    public static final Pattern STRUCT = Pattern.compile(VISIBILITY + "\\bstruct\\s+" + NAME);

    public static final Pattern ENUM = Pattern.compile(VISIBILITY + "\\benum\\s+" + NAME);

    public static final Pattern TRAIT = Pattern.compile(
        VISIBILITY + "(?:\\bunsafe\\s+)?(?:\\bauto\\s+)?\\btrait\\s+" + NAME);

    public static final Pattern FN = Pattern.compile(
        VISIBILITY + "(?:\\b(?:default|const|async|unsafe)\\s+)*(?:\\bextern\\s+(?:\"[^\"]*\"\\s+)?)?\\bfn\\s+" + NAME);

    public static final Pattern MOD = Pattern.compile(VISIBILITY + "\\bmod\\s+" + NAME);

    // impl blocks start a line; "-> impl Trait" return types are not declarations
    public static final Pattern IMPL = Pattern.compile(
        "(?m)^[ \\t]*(?:unsafe\\s+)?impl(?:\\s*" + GENERICS + ")?\\s+!?(?:dyn\\s+)?" + PATH_PREFIX + NAME);

    public static final Pattern TYPE = Pattern.compile(VISIBILITY + "\\btype\\s+" + NAME);

    // a const right after '<' or ',' is a const generic parameter, not an item
    public static final Pattern CONST = Pattern.compile(
        VISIBILITY + "(?<![<,]\\s{0,32})\\bconst\\s+(?!(?:fn|unsafe|async|extern)\\b)" + NAME + "\\s*:");

    public static final Pattern STATIC = Pattern.compile(
        VISIBILITY + "(?<!')\\bstatic\\s+(?:mut\\s+)?" + NAME + "\\s*:");

    /** Declaration patterns in extraction order. */
    public static final Map<EntityKind, Pattern> DECLARATIONS;

    static {
        Map<EntityKind, Pattern> declarations = new EnumMap<>(EntityKind.class);
        declarations.put(EntityKind.STRUCT, STRUCT);
        declarations.put(EntityKind.ENUM, ENUM);
        declarations.put(EntityKind.TRAIT, TRAIT);
        declarations.put(EntityKind.FN, FN);
        declarations.put(EntityKind.MOD, MOD);
        declarations.put(EntityKind.IMPL, IMPL);
        declarations.put(EntityKind.TYPE, TYPE);
        declarations.put(EntityKind.CONST, CONST);
        declarations.put(EntityKind.STATIC, STATIC);
        DECLARATIONS = Collections.unmodifiableMap(declarations);
    }

    // ==================== Relationships ====================

    /** {@code impl Trait for Type}: groups {@code trait} and {@code type}. */
    public static final Pattern IMPLEMENTS = Pattern.compile(
        "\\bimpl(?:\\s*" + GENERICS + ")?\\s+" + PATH_PREFIX + "(?<trait>" + IDENT + ")(?:\\s*" + GENERICS + ")?"
            + "\\s+for\\s+&?(?:'" + IDENT + "\\s+)?(?:mut\\s+)?(?:dyn\\s+)?" + PATH_PREFIX + "(?<type>" + IDENT + ")");

    /** {@code #[derive(A, B)] struct Name}: groups {@code traits} and {@code name}. */
    public static final Pattern DERIVES = Pattern.compile(
        "#\\[derive\\((?<traits>[^)]*)\\)\\]\\s*(?:#\\[[^\\]]*\\]\\s*)*"
            + "(?:pub(?:\\s*\\([^)]*\\))?\\s+)?(?:struct|enum)\\s+" + NAME);

    /** Module declaration: group {@code name}. */
    public static final Pattern CONTAINS = Pattern.compile("\\bmod\\s+" + NAME);

    /**
     * Import path: group {@code path}, plus {@code group} for a flat brace list.
     * {@code tail} is set whenever the path continues with a brace list or a glob.
     */
    public static final Pattern USES = Pattern.compile(
        "\\buse\\s+(?:::)?(?<path>" + IDENT + "(?:::" + IDENT + ")*)"
            + "(?<tail>::\\{(?<group>[^{}]*)\\}|::\\{|::\\*)?");

    /** Field-style annotation {@code name: Type}: group {@code type}, one wrapper stripped. */
    public static final Pattern REFERENCES = Pattern.compile(
        "(?<field>\\w+)\\s*:\\s*&?(?:'" + IDENT + "\\s+)?(?:mut\\s+)?(?:(?:Option|Vec|Box|Arc|Rc)<)?(?<type>\\w+)");

    /** Names that never become reference targets. */
    public static final Set<String> PRIMITIVE_TYPES = Set.of(
        "str", "String", "usize", "isize",
        "i8", "i16", "i32", "i64", "i128",
        "u8", "u16", "u32", "u64", "u128",
        "f32", "f64", "bool", "char", "Self"
    );

    private RustPatterns() {
        throw new AssertionError("Utility class should not be instantiated");
    }
}
