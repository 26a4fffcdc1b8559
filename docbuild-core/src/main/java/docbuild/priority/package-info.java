/**
 * Pure scheduling policy: which candidates are dropped and how urgent the rest are.
 */
package docbuild.priority;
