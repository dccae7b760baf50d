package markbridge.ast.doc;

/**
 * Node of the document tree shared by both languages.
 *
 * Block and inline nodes live in one hierarchy; containers own their children as
 * lists and keep them in document order. The script nodes ({@link LetBinding},
 * {@link ForLoop}, {@link Conditional}, {@link Embed}, {@link CodeBlockNode},
 * {@link Directive}) only occur in raw Typst trees and are gone after evaluation.
 */
public sealed interface DocNode permits Document, Heading, Paragraph, ListBlock, ListItem, Quote, CodeBlock,
		InlineCode, InlineMath, BlockMath, TableNode, Figure, Image, Reference, BibEntry, Bibliography, Raw,
		LossMarker, Graphic, Text, Strong, Emph, LineBreak, Link, Opaque, LetBinding, ForLoop, Conditional,
		Embed, CodeBlockNode, Directive, PageSetup {
}
