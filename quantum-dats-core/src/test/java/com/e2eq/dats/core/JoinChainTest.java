package com.e2eq.dats.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class JoinChainTest {

    @Test
    public void fromDefaultsToPreviousStep() {
        JoinChain chain = JoinChain.start("a", "A")
                .hop("b", "p1", "B")
                .hop("c", "p2", "C")
                .from("a").literal("d", "p3")
                .build();
        assertEquals("a", chain.step(1).from());
        assertEquals("b", chain.step(2).from());
        assertEquals("a", chain.step(3).from());
        assertEquals(List.of("a", "b", "c", "d"), chain.labels());
        assertEquals(3, chain.indexOf("d"));
        assertTrue(chain.step(0).isStart());
    }

    @Test
    public void invalidChainsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> JoinChain.of(List.of()));
        assertThrows(IllegalArgumentException.class,
                () -> JoinChain.start("a", "A").hop("a", "p", "B").build(), "duplicate label");
        assertThrows(IllegalArgumentException.class,
                () -> JoinChain.start("a", "A").from("zz").hop("b", "p", "B").build(), "unknown from");
        assertThrows(IllegalArgumentException.class,
                () -> JoinChain.start("a", "A").literal("v", "p").hop("b", "q", "B").build(), "walk from literal");
        assertThrows(IllegalArgumentException.class,
                () -> JoinChain.start("a", "A").hop("b", " ", "B").build(), "blank predicate");
        assertThrows(IllegalArgumentException.class,
                () -> JoinChain.of(List.of(new JoinStep("a", null, null, TypeFilter.literal(), null, null))), "literal start");
        assertThrows(IllegalArgumentException.class,
                () -> JoinChain.of(List.of(JoinStep.start("a", "A"),
                        new JoinStep("b", "c", "p", TypeFilter.anyNode(), null, null),
                        new JoinStep("c", "a", "q", TypeFilter.anyNode(), null, null))), "forward from");
        assertThrows(IllegalArgumentException.class,
                () -> JoinChain.start("a", "A").literal("v", "p").equalTo("x").param("y").build(), "value and parameter");
        assertThrows(IllegalArgumentException.class, () -> TypeFilter.ofType(""));
    }

    @Test
    public void queryValidatesColumns() {
        JoinChain chain = JoinChain.start("a", "A").hop("b", "p", "B").param("which").build();
        assertEquals(Set.of("which"), chain.parameters());
        assertEquals(List.of("a", "b"), JoinQuery.of(chain).select());
        assertThrows(IllegalArgumentException.class, () -> JoinQuery.builder(chain).select("x").build());
        assertThrows(IllegalArgumentException.class, () -> JoinQuery.builder(chain).select("a").orderBy("b").build());
    }
}
