/**
 * Clause translation from Cypher to KQL graph operators.
 *
 * <p>Key components:</p>
 * <ul>
 *   <li>{@link com.yellowstone.kql.translate.SchemaResolver} - Binds
 *       variables and resolves labels, types and properties to tables and
 *       fields</li>
 *   <li>{@link com.yellowstone.kql.translate.MatchTranslator} - Translates
 *       MATCH clauses to graph-match stages</li>
 *   <li>{@link com.yellowstone.kql.translate.ConditionTranslator} -
 *       Translates WHERE conditions to predicates</li>
 *   <li>{@link com.yellowstone.kql.translate.ProjectionTranslator} -
 *       Translates RETURN to project or summarize stages</li>
 * </ul>
 */
package com.yellowstone.kql.translate;
