package org.assertflat.synth;

import java.util.HashSet;
import java.util.Set;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.expr.SimpleName;

/**
 * Hands out lambda parameter names that do not collide with any identifier of the enclosing member
 * declaration, nor with names handed out earlier by the same allocator.
 */
public class NameAllocator {

    private final Set<String> allocated = new HashSet<>();

    public String allocate(Node near, String preferred) {
        Set<String> taken = identifiersAround(near);
        String candidate = preferred;
        int suffix = 1;
        while (taken.contains(candidate) || allocated.contains(candidate)) {
            candidate = preferred + suffix++;
        }
        allocated.add(candidate);
        return candidate;
    }

    private static Set<String> identifiersAround(Node near) {
        Node scope = near.findAncestor(BodyDeclaration.class).map(Node.class::cast)
                .orElseGet(() -> near.findRootNode());
        Set<String> names = new HashSet<>();
        for (SimpleName name : scope.findAll(SimpleName.class)) {
            names.add(name.getIdentifier());
        }
        return names;
    }
}
