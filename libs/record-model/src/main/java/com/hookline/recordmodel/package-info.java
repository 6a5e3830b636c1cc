/**
 * Declarative record descriptors and the validation engine that turns decoded JSON maps into
 * immutable {@link com.hookline.recordmodel.ValidatedRecord}s.
 *
 * <p>Nothing here knows about GitHub; descriptors are data, loaded by
 * {@link com.hookline.recordmodel.DescriptorLoader}.
 */
package com.hookline.recordmodel;
