package com.autopar.adapter.static_analysis;

import com.autopar.core.tree.SyntaxTree;

/**
 * One compilation unit after conversion.
 *
 * @param path        source path relative to the project root, with forward slashes
 * @param name        program name (primary type, or file name without extension)
 * @param tree        the converted tree; rewrites replace its snapshot in place
 * @param unsupported constructs replaced by unknown calls during conversion
 */
public record ConvertedUnit(String path, String name, SyntaxTree tree, int unsupported) {}
