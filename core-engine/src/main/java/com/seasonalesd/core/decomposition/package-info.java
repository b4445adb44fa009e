/**
 * Seasonal decomposition contract and its STL implementation.
 */
package com.seasonalesd.core.decomposition;
