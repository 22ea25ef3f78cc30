package org.javai.springai.weave.ast;

public record ObjectProperty(String key, Expression value) {
}
