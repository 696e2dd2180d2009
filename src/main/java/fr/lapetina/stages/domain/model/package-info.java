/**
 * Value types shared by the stage runtime, dispatchers and the admin API.
 *
 * <p>All types here are immutable and safe to pass between stage threads.
 */
package fr.lapetina.stages.domain.model;
