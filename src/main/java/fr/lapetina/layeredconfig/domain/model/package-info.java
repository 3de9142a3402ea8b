/**
 * Value types shared across the configuration manager.
 */
package fr.lapetina.layeredconfig.domain.model;
