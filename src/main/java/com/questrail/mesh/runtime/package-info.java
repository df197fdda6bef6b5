/**
 * Composition root for a mesh node.
 */
package com.questrail.mesh.runtime;
