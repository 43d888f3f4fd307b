package tech.charforge.queue.model;

/**
 * Kind of generation work carried by a job's payload.
 */
public enum JobType {
    /** One image from a prompt. */
    SINGLE,
    /** One image from structured character specifications. */
    CHARACTER,
    /** Up to a fixed number of independent prompts processed together. */
    BATCH
}
