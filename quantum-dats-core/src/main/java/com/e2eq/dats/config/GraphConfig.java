package com.e2eq.dats.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Maps graph construction properties (prefix {@code quantum.dats.graph}).
 */
@ConfigMapping(prefix = "quantum.dats.graph")
public interface GraphConfig {

    /**
     * Whether back-links may be created. When false every back-link request is a no-op and the
     * produced document is acyclic apart from reference sharing.
     * @return the back-link flag
     */
    @WithDefault("true")
    boolean allowBackLinks();

    /**
     * Repeated property on the source node that receives back-link carrier nodes.
     * @return the slot name
     */
    @WithDefault("characteristics")
    String backLinkSlot();

    /**
     * Type tag of the carrier node holding a back-link.
     * @return the carrier type
     */
    @WithDefault("Dimension")
    String backLinkType();

    /**
     * Property whose string value is taken as an explicit identifier.
     * @return the identifier property name
     */
    @WithDefault("@id")
    String identifierProperty();

    /**
     * Indent serialized documents.
     * @return the pretty-print flag
     */
    @WithDefault("true")
    boolean prettyPrint();
}
