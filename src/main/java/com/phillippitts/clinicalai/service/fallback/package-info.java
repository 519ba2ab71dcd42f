/**
 * Primary/secondary backend composition with budget admission and usage accounting.
 */
package com.phillippitts.clinicalai.service.fallback;
