package io.stylusport.anchor.syntax;

public sealed interface ParameterNode permits TypedParameterNode, ReceiverParameterNode {

    SourceLocation getLocation();
}
