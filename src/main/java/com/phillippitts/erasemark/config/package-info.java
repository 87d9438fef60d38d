/**
 * Spring configuration: executors, HTTP clients and bound {@code inpaint.*} properties.
 */
package com.phillippitts.erasemark.config;
