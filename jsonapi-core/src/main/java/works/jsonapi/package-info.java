/**
 * Types describing JSON:API documents, and the rules they must obey.
 */
package works.jsonapi;
