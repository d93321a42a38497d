package io.github.simbo1905.mcnp.input;

/// Builds the syntax tree of one kind of record from its tokens.
///
/// A grammar returns null, or leaves tokens unconsumed, when the record does not match; the
/// [RecordParser] turns that into a [ParseProblem]. Each call builds fresh rule state, so a grammar
/// instance may be shared but a [TokenCursor] may not.
@FunctionalInterface
public interface Grammar {

    /// @throws RedundantParameterException if a parameter key is repeated
    /// @throws UnsupportedFeatureException if the record uses syntax that is recognised but not supported
    SyntaxNode parse(TokenCursor cursor, InputRecord record);
}
