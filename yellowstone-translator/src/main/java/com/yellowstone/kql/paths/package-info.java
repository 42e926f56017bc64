/**
 * Variable-length paths, shortest paths and path enumeration.
 */
package com.yellowstone.kql.paths;
