/**
 * Watermark removal pipeline.
 *
 * <p>{@link com.phillippitts.erasemark.service.WatermarkRemovalService} is the entry point.
 * Sub-packages hold the mask builder, patch planner, tile processor, blender, the neural
 * model and the prioritized backend chain (cloud, local, classical).
 */
package com.phillippitts.erasemark.service;
