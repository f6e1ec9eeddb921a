package io.github.mathml.content;

import io.github.mathml.content.ContentNode.*;
import io.github.mathml.content.ParseError.DepthExceededError;
import io.github.mathml.content.ParseError.NamespaceError;
import io.github.mathml.content.ParseError.StructureError;
import io.github.mathml.content.ParseError.UnknownElementError;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// Translates an XML element tree into the Content Markup AST.
///
/// Usage:
/// ```java
/// XmlNode.Element math = ...; // from an XML reader
/// TranslationResult<ContentNode.Root> result = ContentTranslator.withDefaults().translate(math);
/// if (result.isSuccess()) {
///     ContentNode.Root root = result.node();
/// }
/// ```
///
/// Dispatch is by exact tag name: the [BuiltinOp] table first, then the structural
/// elements `math`, `apply`, `ci`, `cn`, `csymbol` and `sep`. Anything else fails with
/// [UnknownElementError], except that an unrecognized childless element in the operator
/// position of an `<apply>` becomes an [Operator.Symbol].
///
/// Instances are immutable and may be shared between threads. Each call is independent.
public final class ContentTranslator {

    private static final Logger LOG = Logger.getLogger(ContentTranslator.class.getName());

    /// The namespace the root `<math>` element must be in.
    public static final String MATHML_NAMESPACE = "http://www.w3.org/1998/Math/MathML";

    private static final Set<String> CN_KNOWN_ATTRIBUTES =
            Set.of("type", "base", "encoding", "definitionURL", "definitionUrl");

    private static final ContentTranslator DEFAULT = new ContentTranslator(TranslatorOptions.DEFAULT);

    /// Where an element sits relative to its parent. Decides what it may translate to.
    private enum Slot {
        /// First child of an `<apply>`.
        OPERATOR,
        /// Any other expression position.
        OPERAND,
        /// Direct child of a `<cn>`, the only place `<sep/>` is allowed.
        NUMBER_CONTENT,
        /// Direct child of a `<ci>` or `<csymbol>`.
        TOKEN_CONTENT
    }

    private final TranslatorOptions options;

    public ContentTranslator(TranslatorOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    /// Translator using [TranslatorOptions#DEFAULT].
    public static ContentTranslator withDefaults() {
        return DEFAULT;
    }

    public TranslatorOptions options() {
        return options;
    }

    /// Translates a whole document, whose root must be a `<math>` element in the MathML namespace.
    /// @param document the root element
    /// @return the tree, or the first error found
    /// @throws NullPointerException if document is null
    public TranslationResult<Root> translate(XmlNode.Element document) {
        Objects.requireNonNull(document, "document must not be null");
        LOG.fine(() -> "Translating document <" + document.name() + "> with " + options.summary());
        try {
            return TranslationResult.success(translateOrThrow(document));
        } catch (MathMlParseException e) {
            LOG.fine(() -> "Translation failed: " + e.getMessage());
            return TranslationResult.failure(e.error());
        }
    }

    /// Like [#translate] but throws on failure.
    /// @throws MathMlParseException if the document is not valid Content Markup
    public Root translateOrThrow(XmlNode.Element document) {
        Objects.requireNonNull(document, "document must not be null");
        final ElementPath path = ElementPath.root(document.name());
        if (!"math".equals(document.name())) {
            throw structure(document.name(), "document root must be <math>", path);
        }
        return translateMath(document, path);
    }

    /// Translates a bare content expression such as an `<apply>` that is not wrapped in `<math>`.
    /// No namespace check is made.
    /// @param element the expression element
    /// @return the translated expression, or the first error found
    public TranslationResult<ContentNode> translateExpression(XmlNode.Element element) {
        Objects.requireNonNull(element, "element must not be null");
        LOG.fine(() -> "Translating expression <" + element.name() + "> with " + options.summary());
        try {
            final Deque<Frame> stack = new ArrayDeque<>();
            final ContentNode leaf = enter(element, ElementPath.root(element.name()), 1, Slot.OPERAND, stack);
            return TranslationResult.success(leaf != null ? leaf : drain(stack));
        } catch (MathMlParseException e) {
            LOG.fine(() -> "Translation failed: " + e.getMessage());
            return TranslationResult.failure(e.error());
        }
    }

    private Root translateMath(XmlNode.Element math, ElementPath path) {
        checkDepth(1);
        final String namespace = resolveNamespace(math);
        if (!MATHML_NAMESPACE.equals(namespace)) {
            throw new MathMlParseException(new NamespaceError(namespace));
        }
        requireNoText(math, path);

        final Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(Container.MATH, math, path, 1));
        final Root root = (Root) drain(stack);
        LOG.finer(() -> "Translated <math> with " + root.children().size() + " top-level expressions");
        return root;
    }

    /// The reader's resolved namespace if it supplied one, otherwise a literal `xmlns` attribute.
    private static String resolveNamespace(XmlNode.Element math) {
        if (math.namespaceUri() != null) {
            return math.namespaceUri();
        }
        return math.attribute("xmlns");
    }

    /// Element kinds that hold translated children.
    private enum Container {
        MATH(Slot.OPERAND),
        APPLY(Slot.OPERAND),
        CI(Slot.TOKEN_CONTENT),
        CSYMBOL(Slot.TOKEN_CONTENT),
        CN(Slot.NUMBER_CONTENT);

        final Slot childSlot;

        Container(Slot childSlot) {
            this.childSlot = childSlot;
        }

        /// Token elements keep their text; `math` and `apply` only allow whitespace.
        boolean keepsText() {
            return this != MATH && this != APPLY;
        }
    }

    /// A container element whose children are still being translated.
    private static final class Frame {
        final Container container;
        final XmlNode.Element element;
        final ElementPath path;
        final int depth;
        final List<ContentNode> translated = new ArrayList<>();
        final StringBuilder textRun = new StringBuilder();
        int nextChild;
        int elementCount;

        Frame(Container container, XmlNode.Element element, ElementPath path, int depth) {
            this.container = container;
            this.element = element;
            this.path = path;
            this.depth = depth;
        }
    }

    /// Runs the work stack until the bottom frame is complete and returns its node.
    ///
    /// Nesting lives on the heap rather than the call stack, so a deep document stops at
    /// the depth guard however high the limit is set.
    private ContentNode drain(Deque<Frame> stack) {
        while (true) {
            final Frame top = stack.peek();
            final List<XmlNode> children = top.element.children();
            if (top.nextChild == children.size()) {
                stack.pop();
                if (top.container.keepsText()) {
                    flushText(top.textRun, top.translated);
                }
                final ContentNode node = complete(top);
                if (stack.isEmpty()) {
                    return node;
                }
                stack.peek().translated.add(node);
                continue;
            }

            final XmlNode child = children.get(top.nextChild++);
            if (child instanceof XmlNode.Text text) {
                if (top.container.keepsText()) {
                    top.textRun.append(text.value());
                }
            } else if (child instanceof XmlNode.Element nested) {
                flushText(top.textRun, top.translated);
                top.elementCount++;
                final Slot slot = top.container == Container.APPLY && top.elementCount == 1
                        ? Slot.OPERATOR
                        : top.container.childSlot;
                final ContentNode leaf = enter(
                        nested, top.path.child(nested.name(), top.elementCount), top.depth + 1, slot, stack);
                if (leaf != null) {
                    top.translated.add(leaf);
                }
            }
        }
    }

    /// Translates a childless element directly, or validates a container element and
    /// pushes a frame for it.
    /// @return the translated leaf, or null if a frame was pushed
    private ContentNode enter(XmlNode.Element element, ElementPath path, int depth, Slot slot, Deque<Frame> stack) {
        checkDepth(depth);
        final String tag = element.name();
        LOG.finer(() -> "Translating <" + tag + "> at " + path + " as " + slot);

        final Optional<BuiltinOp> builtin = BuiltinOp.lookup(tag);
        if (builtin.isPresent()) {
            requireChildless(element, path);
            return new Op(builtin.get());
        }

        switch (tag) {
            case "apply" -> {
                requireNoText(element, path);
                if (element.childElements().isEmpty()) {
                    throw structure(tag, "<apply> requires at least one child element", path);
                }
                stack.push(new Frame(Container.APPLY, element, path, depth));
                return null;
            }
            case "ci" -> {
                stack.push(new Frame(Container.CI, element, path, depth));
                return null;
            }
            case "csymbol" -> {
                stack.push(new Frame(Container.CSYMBOL, element, path, depth));
                return null;
            }
            case "cn" -> {
                stack.push(new Frame(Container.CN, element, path, depth));
                return null;
            }
            case "sep" -> {
                if (slot != Slot.NUMBER_CONTENT) {
                    throw structure(tag, "<sep/> is only allowed directly inside <cn>", path);
                }
                requireChildless(element, path);
                return new Sep();
            }
            case "math" -> throw structure(tag, "<math> may only appear as the document root", path);
            default -> {
                if (slot == Slot.OPERATOR && element.childElements().isEmpty() && !element.hasNonBlankText()) {
                    LOG.finer(() -> "Treating unrecognized <" + tag + "/> at " + path + " as a symbol");
                    return Op.symbol(tag);
                }
                throw new MathMlParseException(new UnknownElementError(tag, path.toString()));
            }
        }
    }

    /// Builds the node for a frame whose children are all translated.
    private static ContentNode complete(Frame frame) {
        final XmlNode.Element element = frame.element;
        return switch (frame.container) {
            case MATH -> new Root(frame.translated);
            case APPLY -> new Apply(frame.translated);
            case CI -> new Ci(frame.translated, element.attribute("type"));
            case CSYMBOL -> new Csymbol(frame.translated, definitionUrl(element), element.attribute("encoding"));
            case CN -> completeCn(element, frame.path, frame.translated);
        };
    }

    private static Cn completeCn(XmlNode.Element cn, ElementPath path, List<ContentNode> content) {
        final NumberValue value;
        final int base;
        try {
            base = CnNumbers.parseBase(cn.attribute("base"));
            value = CnNumbers.interpret(cn.attribute("type"), base, content);
        } catch (IllegalArgumentException e) {
            throw structure("cn", e.getMessage(), path);
        }

        final Map<String, String> extra = new LinkedHashMap<>();
        for (final XmlNode.Attribute attribute : cn.attributes()) {
            final String name = attribute.name();
            if (!CN_KNOWN_ATTRIBUTES.contains(name) && !name.equals("xmlns") && !name.startsWith("xmlns:")) {
                extra.put(name, attribute.value());
            }
        }
        return new Cn(content, value, base, definitionUrl(cn), cn.attribute("encoding"), extra);
    }

    private static void flushText(StringBuilder run, List<ContentNode> content) {
        if (run.length() == 0) {
            return;
        }
        final String normalized = TextNormalizer.normalize(run.toString());
        run.setLength(0);
        if (!normalized.isEmpty()) {
            content.add(new Text(normalized));
        }
    }

    private static String definitionUrl(XmlNode.Element element) {
        final String url = element.attribute("definitionURL");
        return url != null ? url : element.attribute("definitionUrl");
    }

    private void checkDepth(int depth) {
        if (depth > options.maxDepth()) {
            LOG.fine(() -> "Depth " + depth + " exceeds limit " + options.maxDepth());
            throw new MathMlParseException(new DepthExceededError(options.maxDepth()));
        }
    }

    /// Token elements are empty; formatting whitespace is tolerated, attributes are not checked.
    private static void requireChildless(XmlNode.Element element, ElementPath path) {
        if (!element.childElements().isEmpty()) {
            throw structure(element.name(), "token element must not have child elements", path);
        }
        if (element.hasNonBlankText()) {
            throw structure(element.name(), "token element must not have text content", path);
        }
    }

    private static void requireNoText(XmlNode.Element element, ElementPath path) {
        if (element.hasNonBlankText()) {
            throw structure(element.name(), "unexpected text content", path);
        }
    }

    private static MathMlParseException structure(String tag, String reason, ElementPath path) {
        return new MathMlParseException(new StructureError(tag, reason, path.toString()));
    }
}
