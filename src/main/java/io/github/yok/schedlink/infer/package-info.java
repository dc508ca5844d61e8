/**
 * Sex inference from first names. The load pipeline treats this as an opaque collaborator whose
 * failures degrade to an absent value.
 */
package io.github.yok.schedlink.infer;
