/**
 * Immutable value types shared across the inpainting pipeline.
 *
 * <p>{@link com.phillippitts.erasemark.domain.Mask} wraps an OpenCV raster; all other types
 * are plain records.
 */
package com.phillippitts.erasemark.domain;
